package tech.noetzold.results_gateway.filter;

import tech.noetzold.results_gateway.model.RuleContent;
import tech.noetzold.results_gateway.model.RuleHit;

@FunctionalInterface
public interface RulePolicy {

    boolean admits(RuleHit hit, RuleContent content);
}
