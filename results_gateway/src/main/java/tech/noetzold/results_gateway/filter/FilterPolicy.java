package tech.noetzold.results_gateway.filter;

import tech.noetzold.results_gateway.model.RuleContent;
import tech.noetzold.results_gateway.model.RuleHit;

import java.util.List;

public record FilterPolicy(
        boolean includeDisabled,
        List<RulePolicy> contentPolicies
) {

    public FilterPolicy {
        contentPolicies = List.copyOf(contentPolicies);
    }

    public static FilterPolicy of(boolean includeDisabled, RulePolicy... contentPolicies) {
        return new FilterPolicy(includeDisabled, List.of(contentPolicies));
    }

    public boolean admits(RuleHit hit, RuleContent content) {
        for (RulePolicy policy : contentPolicies) {
            if (!policy.admits(hit, content)) {
                return false;
            }
        }
        return true;
    }
}
