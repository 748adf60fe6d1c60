package tech.noetzold.results_gateway.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.results_gateway.content.ContentLookup;
import tech.noetzold.results_gateway.exception.ContentServiceTimeoutException;
import tech.noetzold.results_gateway.model.EnrichedRule;
import tech.noetzold.results_gateway.model.RuleContent;
import tech.noetzold.results_gateway.model.RuleHit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class RuleFilter {

    private final ContentLookup contentLookup;

    public RuleFilter(ContentLookup contentLookup) {
        this.contentLookup = contentLookup;
    }

    /**
     * @throws ContentServiceTimeoutException if content is unavailable for any hit
     */
    public FilterResult filter(List<RuleHit> hits, FilterPolicy policy) {
        log.debug("Filtering {} rules, policy {}", hits.size(), policy);

        List<EnrichedRule> visible = new ArrayList<>();
        int noContent = 0;
        int disabled = 0;

        for (RuleHit hit : hits) {
            Classification classification = classify(hit, policy, contentLookup);
            switch (classification.outcome()) {
                case VISIBLE -> visible.add(classification.rule());
                case DISABLED -> disabled++;
                case NO_CONTENT -> noContent++;
            }
        }

        return new FilterResult(List.copyOf(visible), noContent, disabled);
    }

    public Classification classify(RuleHit hit, FilterPolicy policy) {
        return classify(hit, policy, contentLookup);
    }

    public static Classification classify(RuleHit hit, FilterPolicy policy, ContentLookup lookup) {
        if (hit.disabled() && !policy.includeDisabled()) {
            return Classification.DISABLED;
        }

        Optional<RuleContent> content = lookup.contentFor(hit.component(), hit.key());
        if (content.isEmpty()) {
            log.debug("No content for rule {}", hit.selector());
            return Classification.NO_CONTENT;
        }
        if (!policy.admits(hit, content.get())) {
            return Classification.NO_CONTENT;
        }
        return new Classification(FilterOutcome.VISIBLE, EnrichedRule.of(hit, content.get()));
    }

    public record Classification(FilterOutcome outcome, EnrichedRule rule) {

        static final Classification DISABLED = new Classification(FilterOutcome.DISABLED, null);
        static final Classification NO_CONTENT = new Classification(FilterOutcome.NO_CONTENT, null);
    }
}
