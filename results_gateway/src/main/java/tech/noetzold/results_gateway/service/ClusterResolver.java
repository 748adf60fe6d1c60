package tech.noetzold.results_gateway.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.results_gateway.client.AggregatorClient;
import tech.noetzold.results_gateway.client.MembershipClient;
import tech.noetzold.results_gateway.config.GatewayProperties;
import tech.noetzold.results_gateway.exception.IdentityServiceUnavailableException;
import tech.noetzold.results_gateway.model.ClusterInfo;
import tech.noetzold.results_gateway.model.ClusterSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the clusters of an organization. AMS is asked first when it is configured;
 * the aggregator's own listing is the fallback. A result always comes from exactly
 * one of the two.
 */
@Slf4j
@Service
public class ClusterResolver {

    static final List<String> EXCLUDED_STATUSES = List.of(
            MembershipClient.STATUS_DEPROVISIONED,
            MembershipClient.STATUS_ARCHIVED
    );

    private final Optional<MembershipClient> membershipClient;
    private final AggregatorClient aggregatorClient;
    private final boolean useFallback;

    public ClusterResolver(Optional<MembershipClient> membershipClient,
                           AggregatorClient aggregatorClient,
                           GatewayProperties properties) {
        this.membershipClient = membershipClient;
        this.aggregatorClient = aggregatorClient;
        this.useFallback = properties.isUseOrgClustersFallback();
    }

    public List<String> clusterIdsForOrg(long orgId) {
        Optional<ClusterSet> fromAms = readFromMembershipService(orgId);
        if (fromAms.isPresent()) {
            List<String> ids = fromAms.get().ids();
            log.info("Organization {}; number of cluster IDs retrieved from AMS: {}", orgId, ids.size());
            return ids;
        }
        return aggregatorClient.readClusterIds(orgId);
    }

    public ClusterSet clustersForOrg(long orgId) {
        Optional<ClusterSet> fromAms = readFromMembershipService(orgId);
        if (fromAms.isPresent()) {
            log.info("Organization {}; number of clusters retrieved from AMS: {}", orgId, fromAms.get().clusters().size());
            return fromAms.get();
        }

        List<String> ids = aggregatorClient.readClusterIds(orgId);
        List<ClusterInfo> clusters = new ArrayList<>(ids.size());
        Map<String, String> displayNames = new LinkedHashMap<>();
        for (String id : ids) {
            clusters.add(new ClusterInfo(id, ""));
            displayNames.put(id, "");
        }
        return new ClusterSet(clusters, displayNames);
    }

    /**
     * @return clusters from AMS, or empty when the aggregator fallback has to be used
     * @throws IdentityServiceUnavailableException when AMS cannot answer and the fallback is off
     */
    private Optional<ClusterSet> readFromMembershipService(long orgId) {
        RuntimeException failure = null;
        if (membershipClient.isPresent()) {
            try {
                return Optional.of(membershipClient.get().clustersForOrg(orgId, EXCLUDED_STATUSES));
            } catch (RuntimeException e) {
                log.error("Error accessing AMS for organization {}", orgId, e);
                failure = e;
            }
        }

        if (!useFallback) {
            throw new IdentityServiceUnavailableException(
                    membershipClient.isPresent() ? "AMS is unavailable" : "AMS client not initialized", failure);
        }

        log.info("Organization {}; using aggregator fallback to list clusters", orgId);
        return Optional.empty();
    }
}
