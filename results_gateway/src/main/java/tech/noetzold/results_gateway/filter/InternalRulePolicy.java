package tech.noetzold.results_gateway.filter;

import tech.noetzold.results_gateway.model.RuleContent;
import tech.noetzold.results_gateway.model.RuleHit;

public final class InternalRulePolicy implements RulePolicy {

    private final boolean permitted;

    InternalRulePolicy(boolean permitted) {
        this.permitted = permitted;
    }

    @Override
    public boolean admits(RuleHit hit, RuleContent content) {
        return !content.internal() || permitted;
    }

    @Override
    public String toString() {
        return "InternalRulePolicy[permitted=" + permitted + "]";
    }
}
