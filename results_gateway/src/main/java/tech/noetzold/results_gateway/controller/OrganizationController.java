package tech.noetzold.results_gateway.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.results_gateway.IdentityInterceptor;
import tech.noetzold.results_gateway.identity.Identity;
import tech.noetzold.results_gateway.model.ApiResponse;
import tech.noetzold.results_gateway.model.ClusterSet;
import tech.noetzold.results_gateway.model.OrgOverview;
import tech.noetzold.results_gateway.service.ClusterResolver;
import tech.noetzold.results_gateway.service.OverviewCalculator;

import java.util.List;
import java.util.Map;

@Tag(name = "Organization")
@RestController
@RequestMapping("${gateway.api-prefix:/api/v1}")
public class OrganizationController {

    private final ClusterResolver clusterResolver;
    private final OverviewCalculator overviewCalculator;

    public OrganizationController(ClusterResolver clusterResolver, OverviewCalculator overviewCalculator) {
        this.clusterResolver = clusterResolver;
        this.overviewCalculator = overviewCalculator;
    }

    @GetMapping("/clusters")
    public Map<String, Object> clusters(@RequestAttribute(IdentityInterceptor.IDENTITY_ATTRIBUTE) Identity identity) {
        ClusterSet clusters = clusterResolver.clustersForOrg(identity.internalOrgId());
        return ApiResponse.ok("clusters", clusters.clusters());
    }

    @GetMapping("/org_overview")
    public Map<String, Object> overview(@RequestAttribute(IdentityInterceptor.IDENTITY_ATTRIBUTE) Identity identity) {
        List<String> clusterIds = clusterResolver.clusterIdsForOrg(identity.internalOrgId());
        OrgOverview overview = overviewCalculator.calculate(identity, clusterIds);
        return ApiResponse.ok("overview", overview);
    }
}
