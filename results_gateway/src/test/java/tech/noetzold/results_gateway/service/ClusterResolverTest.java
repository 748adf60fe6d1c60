package tech.noetzold.results_gateway.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.noetzold.results_gateway.client.AggregatorClient;
import tech.noetzold.results_gateway.client.MembershipClient;
import tech.noetzold.results_gateway.config.GatewayProperties;
import tech.noetzold.results_gateway.exception.IdentityServiceUnavailableException;
import tech.noetzold.results_gateway.exception.MembershipServiceException;
import tech.noetzold.results_gateway.model.ClusterInfo;
import tech.noetzold.results_gateway.model.ClusterSet;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static tech.noetzold.results_gateway.TestData.CLUSTER_ID;
import static tech.noetzold.results_gateway.TestData.OTHER_CLUSTER_ID;

class ClusterResolverTest {

    private MembershipClient membershipClient;
    private AggregatorClient aggregatorClient;
    private GatewayProperties properties;

    @BeforeEach
    void setUp() {
        membershipClient = mock(MembershipClient.class);
        aggregatorClient = mock(AggregatorClient.class);
        properties = new GatewayProperties();
    }

    private ClusterResolver resolver(boolean withAms) {
        return new ClusterResolver(withAms ? Optional.of(membershipClient) : Optional.empty(), aggregatorClient, properties);
    }

    @Test
    void membershipServiceAnswerIsUsedWithoutFallback() {
        ClusterSet fromAms = new ClusterSet(
                List.of(new ClusterInfo(CLUSTER_ID, "production")),
                Map.of(CLUSTER_ID, "production"));
        when(membershipClient.clustersForOrg(eq(1L), anyList())).thenReturn(fromAms);

        ClusterSet clusters = resolver(true).clustersForOrg(1);

        assertEquals(fromAms, clusters);
        verify(membershipClient).clustersForOrg(1L, ClusterResolver.EXCLUDED_STATUSES);
        verifyNoInteractions(aggregatorClient);
    }

    @Test
    void membershipErrorFallsBackToAggregatorWithEmptyDisplayNames() {
        when(membershipClient.clustersForOrg(anyLong(), anyList()))
                .thenThrow(new MembershipServiceException("AMS down", null));
        when(aggregatorClient.readClusterIds(1L)).thenReturn(List.of(CLUSTER_ID, OTHER_CLUSTER_ID));

        ClusterSet clusters = resolver(true).clustersForOrg(1);

        assertEquals(List.of(CLUSTER_ID, OTHER_CLUSTER_ID), clusters.ids());
        assertEquals("", clusters.displayNames().get(CLUSTER_ID));
        assertEquals("", clusters.displayNames().get(OTHER_CLUSTER_ID));
    }

    @Test
    void missingMembershipClientUsesAggregator() {
        when(aggregatorClient.readClusterIds(1L)).thenReturn(List.of(CLUSTER_ID));

        assertEquals(List.of(CLUSTER_ID), resolver(false).clusterIdsForOrg(1));
    }

    @Test
    void membershipErrorWithoutFallbackIsUnavailable() {
        properties.setUseOrgClustersFallback(false);
        when(membershipClient.clustersForOrg(anyLong(), anyList()))
                .thenThrow(new MembershipServiceException("AMS down", null));

        assertThrows(IdentityServiceUnavailableException.class, () -> resolver(true).clusterIdsForOrg(1));
        verifyNoInteractions(aggregatorClient);
    }

    @Test
    void membershipIdsAreReturnedInOrder() {
        when(membershipClient.clustersForOrg(eq(1L), anyList())).thenReturn(new ClusterSet(
                List.of(new ClusterInfo(OTHER_CLUSTER_ID, "b"), new ClusterInfo(CLUSTER_ID, "a")),
                Map.of(OTHER_CLUSTER_ID, "b", CLUSTER_ID, "a")));

        assertEquals(List.of(OTHER_CLUSTER_ID, CLUSTER_ID), resolver(true).clusterIdsForOrg(1));
    }
}
