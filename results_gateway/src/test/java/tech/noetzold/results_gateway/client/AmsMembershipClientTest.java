package tech.noetzold.results_gateway.client;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.results_gateway.config.GatewayProperties;
import tech.noetzold.results_gateway.exception.MembershipServiceException;
import tech.noetzold.results_gateway.model.ClusterSet;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static tech.noetzold.results_gateway.TestData.CLUSTER_ID;
import static tech.noetzold.results_gateway.TestData.OTHER_CLUSTER_ID;

class AmsMembershipClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private AmsMembershipClient client(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://ams:8000/api/accounts_mgmt/v1")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new AmsMembershipClient(webClient, new GatewayProperties());
    }

    @Test
    void returnsClustersWithDisplayNamesSkippingExcludedStatuses() {
        AmsMembershipClient client = client(HttpStatus.OK, """
                {"items":[
                  {"cluster_id":"%s","display_name":"production","status":"Active"},
                  {"cluster_id":"%s","display_name":"old","status":"Archived"},
                  {"cluster_id":"","display_name":"no id","status":"Active"}
                ]}
                """.formatted(CLUSTER_ID, OTHER_CLUSTER_ID));

        ClusterSet clusters = client.clustersForOrg(1, List.of("Deprovisioned", "Archived"));

        assertEquals(List.of(CLUSTER_ID), clusters.ids());
        assertEquals("production", clusters.displayNames().get(CLUSTER_ID));
        String uri = lastRequest.get().url().toString();
        assertTrue(uri.contains("/organizations/1/clusters"));
        assertTrue(uri.contains("excluded_status=Deprovisioned,Archived"));
    }

    @Test
    void errorStatusIsMembershipFailure() {
        AmsMembershipClient client = client(HttpStatus.INTERNAL_SERVER_ERROR, "{}");

        assertThrows(MembershipServiceException.class, () -> client.clustersForOrg(1, List.of()));
    }

    @Test
    void missingItemsIsMembershipFailure() {
        AmsMembershipClient client = client(HttpStatus.OK, "{}");

        assertThrows(MembershipServiceException.class, () -> client.clustersForOrg(1, List.of()));
    }
}
