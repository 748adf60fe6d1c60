package tech.noetzold.results_gateway.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.results_gateway.client.AggregatorClient;
import tech.noetzold.results_gateway.exception.NotFoundException;
import tech.noetzold.results_gateway.exception.PermissionDeniedException;
import tech.noetzold.results_gateway.filter.AudiencePolicy;
import tech.noetzold.results_gateway.filter.FilterOutcome;
import tech.noetzold.results_gateway.filter.FilterPolicy;
import tech.noetzold.results_gateway.filter.FilterResult;
import tech.noetzold.results_gateway.filter.InternalRuleAccess;
import tech.noetzold.results_gateway.filter.RuleFilter;
import tech.noetzold.results_gateway.filter.RulePolicy;
import tech.noetzold.results_gateway.identity.Identity;
import tech.noetzold.results_gateway.model.*;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReportService {

    private final AggregatorClient aggregatorClient;
    private final RuleFilter ruleFilter;
    private final InternalRuleAccess internalRuleAccess;

    public FilteredReport clusterReport(Identity identity, String clusterId, boolean includeDisabled, boolean osdEligible) {
        ClusterReport report = aggregatorClient.readReport(identity.internalOrgId(), clusterId, identity.accountNumber());

        List<RulePolicy> policies = new ArrayList<>();
        policies.add(internalRuleAccess.policyFor(identity.internalOrgId()));
        if (osdEligible) {
            policies.add(AudiencePolicy.osdEligibleOnly());
        }

        FilterResult result = ruleFilter.filter(report.hits(), new FilterPolicy(includeDisabled, policies));
        if (result.isContentMissingForAllHits()) {
            log.error("Cluster ID: {}; Rules are hitting, but we don't have content for any of them.", clusterId);
        }
        log.info("Cluster ID: {}; visible={}, no content={}, disabled={}",
                clusterId, result.visibleCount(), result.noContentCount(), result.disabledCount());

        String lastCheckedAt = report.meta() != null ? report.meta().lastCheckedAt() : null;
        return new FilteredReport(new ReportMeta(result.reportedRuleCount(), lastCheckedAt), result.visibleRules());
    }

    public ReportMetainfo reportMetainfo(Identity identity, String clusterId) {
        ReportMetainfo metainfo = aggregatorClient.readReportMetainfo(
                identity.internalOrgId(), clusterId, identity.accountNumber());
        log.info("Metainfo returned by aggregator for cluster {}: {}", clusterId, metainfo);
        return metainfo;
    }

    public ClusterReports reportsForClusters(Identity identity, List<String> clusterIds) {
        return aggregatorClient.readReportsForClusters(identity.internalOrgId(), clusterIds);
    }

    public ClusterReports reportsForClustersInBody(Identity identity, byte[] body) {
        return aggregatorClient.readReportsForClustersInBody(identity.internalOrgId(), body);
    }

    /**
     * @throws NotFoundException when the rule has no content or the audience filter hides it
     * @throws PermissionDeniedException when the rule is internal and the organization is not entitled
     */
    public EnrichedRule singleRule(Identity identity, String clusterId, String ruleId, String errorKey, boolean osdEligible) {
        RuleHit hit = aggregatorClient.readRule(
                identity.internalOrgId(), clusterId, identity.accountNumber(), ruleId, errorKey);

        FilterPolicy policy = osdEligible
                ? FilterPolicy.of(true, AudiencePolicy.osdEligibleOnly())
                : FilterPolicy.of(true);
        RuleFilter.Classification classification = ruleFilter.classify(hit, policy);
        if (classification.outcome() != FilterOutcome.VISIBLE) {
            throw new NotFoundException("Rule was not found");
        }

        EnrichedRule rule = classification.rule();
        if (rule.isInternal()) {
            log.info("Checking internal rule permissions for Organization ID: {}", identity.internalOrgId());
            if (!internalRuleAccess.isPermitted(identity.internalOrgId())) {
                throw new PermissionDeniedException("This organization is not allowed to access this recommendation");
            }
        }
        return rule;
    }
}
