package tech.noetzold.results_gateway.filter;

import org.junit.jupiter.api.Test;
import tech.noetzold.results_gateway.model.EnrichedRule;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterResultTest {

    private static final EnrichedRule RULE = EnrichedRule.builder().ruleId("a").errorKey("A").build();

    @Test
    void countIsVisiblePlusNoContent() {
        FilterResult result = new FilterResult(List.of(RULE), 2, 5);

        assertEquals(3, result.reportedRuleCount());
        assertFalse(result.isContentMissingForAllHits());
    }

    @Test
    void countIsZeroWhenOnlyContentlessHitsRemain() {
        FilterResult result = new FilterResult(List.of(), 4, 0);

        assertTrue(result.isContentMissingForAllHits());
        assertEquals(0, result.reportedRuleCount());
    }

    @Test
    void noOverrideWhenAnyHitWasDisabled() {
        FilterResult result = new FilterResult(List.of(), 4, 1);

        assertFalse(result.isContentMissingForAllHits());
        assertEquals(4, result.reportedRuleCount());
    }
}
