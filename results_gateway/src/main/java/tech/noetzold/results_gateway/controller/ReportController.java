package tech.noetzold.results_gateway.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.results_gateway.IdentityInterceptor;
import tech.noetzold.results_gateway.exception.BadRequestException;
import tech.noetzold.results_gateway.identity.Identity;
import tech.noetzold.results_gateway.model.ApiResponse;
import tech.noetzold.results_gateway.model.ClusterReports;
import tech.noetzold.results_gateway.model.FilteredReport;
import tech.noetzold.results_gateway.service.ReportService;

import java.util.Map;

import static tech.noetzold.results_gateway.controller.RequestParams.GET_DISABLED_PARAM;
import static tech.noetzold.results_gateway.controller.RequestParams.OSD_ELIGIBLE_PARAM;

@Slf4j
@Tag(name = "Reports")
@RestController
@RequestMapping("${gateway.api-prefix:/api/v1}")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/report/{cluster}")
    public Map<String, Object> report(
            @PathVariable("cluster") String cluster,
            @RequestParam(value = GET_DISABLED_PARAM, required = false) String getDisabled,
            @RequestParam(value = OSD_ELIGIBLE_PARAM, required = false) String osdEligible,
            @RequestAttribute(IdentityInterceptor.IDENTITY_ATTRIBUTE) Identity identity) {
        String clusterId = RequestParams.clusterName(cluster);
        boolean includeDisabled = RequestParams.booleanParam(GET_DISABLED_PARAM, getDisabled);
        boolean osdFlag = readOsdEligible(clusterId, osdEligible);

        log.info("Cluster ID: {}; {} flag = {}", clusterId, GET_DISABLED_PARAM, includeDisabled);
        log.info("Cluster ID: {}; {} flag = {}", clusterId, OSD_ELIGIBLE_PARAM, osdFlag);

        FilteredReport report = reportService.clusterReport(identity, clusterId, includeDisabled, osdFlag);
        return ApiResponse.ok("report", report);
    }

    @GetMapping("/report/{cluster}/info")
    public Map<String, Object> reportMetainfo(
            @PathVariable("cluster") String cluster,
            @RequestAttribute(IdentityInterceptor.IDENTITY_ATTRIBUTE) Identity identity) {
        return ApiResponse.ok("metainfo", reportService.reportMetainfo(identity, RequestParams.clusterName(cluster)));
    }

    @GetMapping("/reports/{cluster_list}")
    public ClusterReports reportsForClusterList(
            @PathVariable("cluster_list") String clusterList,
            @RequestAttribute(IdentityInterceptor.IDENTITY_ATTRIBUTE) Identity identity) {
        return reportService.reportsForClusters(identity, RequestParams.clusterList(clusterList));
    }

    @PostMapping("/reports")
    public ClusterReports reportsForClusterListInBody(
            @RequestBody(required = false) byte[] body,
            @RequestAttribute(IdentityInterceptor.IDENTITY_ATTRIBUTE) Identity identity) {
        if (body == null || body.length == 0) {
            throw new BadRequestException("Cluster list must be provided in request body");
        }
        return reportService.reportsForClustersInBody(identity, body);
    }

    @GetMapping("/report/{cluster}/rule/{rule_selector}")
    public Map<String, Object> singleRule(
            @PathVariable("cluster") String cluster,
            @PathVariable("rule_selector") String ruleSelector,
            @RequestParam(value = OSD_ELIGIBLE_PARAM, required = false) String osdEligible,
            @RequestAttribute(IdentityInterceptor.IDENTITY_ATTRIBUTE) Identity identity) {
        String clusterId = RequestParams.clusterName(cluster);
        String[] selector = RequestParams.ruleSelector(ruleSelector);
        boolean osdFlag = readOsdEligible(clusterId, osdEligible);

        return ApiResponse.ok("report",
                reportService.singleRule(identity, clusterId, selector[0], selector[1], osdFlag));
    }

    // A malformed value is not fatal: the report is served unfiltered.
    private boolean readOsdEligible(String clusterId, String value) {
        try {
            return RequestParams.booleanParam(OSD_ELIGIBLE_PARAM, value);
        } catch (BadRequestException e) {
            log.warn("Cluster ID: {}; Got error while parsing `{}` value: {}", clusterId, OSD_ELIGIBLE_PARAM, e.getMessage());
            return false;
        }
    }
}
