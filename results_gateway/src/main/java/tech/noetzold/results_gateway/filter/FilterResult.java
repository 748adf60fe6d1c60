package tech.noetzold.results_gateway.filter;

import tech.noetzold.results_gateway.model.EnrichedRule;

import java.util.List;

public record FilterResult(
        List<EnrichedRule> visibleRules,
        int noContentCount,
        int disabledCount
) {

    public int visibleCount() {
        return visibleRules.size();
    }

    /**
     * Rule count reported to clients: visible plus no-content hits, except that hits
     * without any content are reported as zero when nothing is visible and nothing
     * was disabled, so the report reads as "no issues found".
     */
    public int reportedRuleCount() {
        if (isContentMissingForAllHits()) {
            return 0;
        }
        return visibleCount() + noContentCount;
    }

    public boolean isContentMissingForAllHits() {
        return visibleRules.isEmpty() && noContentCount > 0 && disabledCount == 0;
    }
}
