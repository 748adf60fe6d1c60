package tech.noetzold.results_gateway.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.results_gateway.config.GatewayProperties;
import tech.noetzold.results_gateway.exception.MembershipServiceException;
import tech.noetzold.results_gateway.model.ClusterInfo;
import tech.noetzold.results_gateway.model.ClusterSet;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@ConditionalOnExpression("'${gateway.ams.url:}' != ''")
public class AmsMembershipClient implements MembershipClient {

    static final String CLUSTERS_ENDPOINT = "/organizations/{org_id}/clusters";

    private final WebClient webClient;
    private final Duration timeout;

    public AmsMembershipClient(@Qualifier("amsWebClient") WebClient amsWebClient, GatewayProperties properties) {
        this.webClient = amsWebClient;
        this.timeout = properties.getAms().getTimeout();
    }

    @Override
    public ClusterSet clustersForOrg(long orgId, List<String> excludedStatuses) {
        List<String> excluded = excludedStatuses != null ? excludedStatuses : List.of();

        AmsClusterList response;
        try {
            response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path(CLUSTERS_ENDPOINT)
                            .queryParam("excluded_status", String.join(",", excluded))
                            .build(orgId))
                    .retrieve()
                    .bodyToMono(AmsClusterList.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new MembershipServiceException("Unable to retrieve clusters of organization " + orgId + " from AMS", e);
        }

        if (response == null || response.items() == null) {
            throw new MembershipServiceException("AMS returned no cluster list for organization " + orgId, null);
        }

        List<ClusterInfo> clusters = new ArrayList<>();
        Map<String, String> displayNames = new LinkedHashMap<>();
        for (AmsCluster cluster : response.items()) {
            if (cluster.clusterId() == null || cluster.clusterId().isBlank()) {
                continue;
            }
            if (cluster.status() != null && excluded.stream().anyMatch(s -> s.equalsIgnoreCase(cluster.status()))) {
                continue;
            }
            String displayName = cluster.displayName() != null ? cluster.displayName() : "";
            clusters.add(new ClusterInfo(cluster.clusterId(), displayName));
            displayNames.put(cluster.clusterId(), displayName);
        }

        log.debug("AMS returned {} clusters for organization {}, {} kept", response.items().size(), orgId, clusters.size());
        return new ClusterSet(clusters, displayNames);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AmsClusterList(List<AmsCluster> items) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AmsCluster(
            @JsonProperty("cluster_id") String clusterId,
            @JsonProperty("display_name") String displayName,
            @JsonProperty("status") String status
    ) {}
}
