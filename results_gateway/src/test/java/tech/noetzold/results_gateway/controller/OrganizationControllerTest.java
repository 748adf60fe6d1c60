package tech.noetzold.results_gateway.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import tech.noetzold.results_gateway.IdentityInterceptor;
import tech.noetzold.results_gateway.exception.IdentityServiceUnavailableException;
import tech.noetzold.results_gateway.identity.IdentityResolver;
import tech.noetzold.results_gateway.model.ClusterInfo;
import tech.noetzold.results_gateway.model.ClusterSet;
import tech.noetzold.results_gateway.model.OrgOverview;
import tech.noetzold.results_gateway.service.ClusterResolver;
import tech.noetzold.results_gateway.service.OverviewCalculator;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;
import static tech.noetzold.results_gateway.TestData.CLUSTER_ID;
import static tech.noetzold.results_gateway.TestData.IDENTITY;

class OrganizationControllerTest {

    private ClusterResolver clusterResolver;
    private OverviewCalculator overviewCalculator;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        clusterResolver = mock(ClusterResolver.class);
        overviewCalculator = mock(OverviewCalculator.class);
        IdentityResolver identityResolver = mock(IdentityResolver.class);
        when(identityResolver.resolve(any())).thenReturn(IDENTITY);

        mvc = MockMvcBuilders.standaloneSetup(new OrganizationController(clusterResolver, overviewCalculator))
                .setControllerAdvice(new ErrorHandler())
                .addPlaceholderValue("gateway.api-prefix", "/api/v1")
                .addInterceptors(new IdentityInterceptor(identityResolver))
                .build();
    }

    @Test
    void listsClustersWithDisplayNames() throws Exception {
        when(clusterResolver.clustersForOrg(1L)).thenReturn(new ClusterSet(
                List.of(new ClusterInfo(CLUSTER_ID, "production")), Map.of(CLUSTER_ID, "production")));

        mvc.perform(get("/api/v1/clusters"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clusters[0].cluster_id").value(CLUSTER_ID))
                .andExpect(jsonPath("$.clusters[0].display_name").value("production"));
    }

    @Test
    void identityServiceOutageIsServiceUnavailable() throws Exception {
        when(clusterResolver.clustersForOrg(1L))
                .thenThrow(new IdentityServiceUnavailableException("AMS is unavailable", null));

        mvc.perform(get("/api/v1/clusters"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void returnsOverview() throws Exception {
        when(clusterResolver.clusterIdsForOrg(1L)).thenReturn(List.of(CLUSTER_ID));
        when(overviewCalculator.calculate(IDENTITY, List.of(CLUSTER_ID)))
                .thenReturn(new OrgOverview(1, Map.of(3, 2), Map.of("security", 2)));

        mvc.perform(get("/api/v1/org_overview"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overview.clusters_hit").value(1))
                .andExpect(jsonPath("$.overview.hit_by_risk['3']").value(2))
                .andExpect(jsonPath("$.overview.hit_by_tag.security").value(2));
    }
}
