package tech.noetzold.results_gateway.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.results_gateway.client.AggregatorClient;
import tech.noetzold.results_gateway.content.ContentLookup;
import tech.noetzold.results_gateway.exception.UpstreamResponseException;
import tech.noetzold.results_gateway.identity.Identity;
import tech.noetzold.results_gateway.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Risk and tag overview of an organization. Only content existence is checked
 * here; disabled, audience and internal filters do not apply.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OverviewCalculator {

    private final AggregatorClient aggregatorClient;
    private final ContentLookup contentLookup;

    public OrgOverview calculate(Identity identity, List<String> clusterIds) {
        List<ClusterOverview> overviews = new ArrayList<>();
        for (String clusterId : clusterIds) {
            overviewPerCluster(identity, clusterId).ifPresent(overviews::add);
        }
        return summarize(overviews);
    }

    /**
     * @return empty when the cluster has no report or no hits
     */
    public Optional<ClusterOverview> overviewPerCluster(Identity identity, String clusterId) {
        ClusterReport report;
        try {
            report = aggregatorClient.readReport(identity.internalOrgId(), clusterId, identity.accountNumber());
        } catch (UpstreamResponseException e) {
            log.info("Aggregator doesn't have reports for cluster ID {} (status {})", clusterId, e.getStatusCode().value());
            return Optional.empty();
        }

        if (report.hits().isEmpty()) {
            log.info("Cluster {} report doesn't have any hits. Skipping from overview.", clusterId);
            return Optional.empty();
        }

        List<Integer> totalRisks = new ArrayList<>();
        List<String> tags = new ArrayList<>();
        for (RuleHit hit : report.hits()) {
            Optional<RuleContent> content = contentLookup.contentFor(hit.component(), hit.key());
            if (content.isEmpty()) {
                log.warn("Unable to retrieve content for rule {}", hit.selector());
                continue;
            }
            totalRisks.add(content.get().totalRisk());
            tags.addAll(content.get().tagList());
        }

        return Optional.of(new ClusterOverview(totalRisks, tags));
    }

    static OrgOverview summarize(List<ClusterOverview> overviews) {
        Map<Integer, Integer> hitByRisk = new TreeMap<>();
        Map<String, Integer> hitByTag = new TreeMap<>();
        for (ClusterOverview overview : overviews) {
            overview.totalRisksHit().forEach(risk -> hitByRisk.merge(risk, 1, Integer::sum));
            overview.tagsHit().forEach(tag -> hitByTag.merge(tag, 1, Integer::sum));
        }
        return new OrgOverview(overviews.size(), hitByRisk, hitByTag);
    }
}
