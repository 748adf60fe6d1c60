package tech.noetzold.results_gateway.filter;

import tech.noetzold.results_gateway.model.RuleContent;
import tech.noetzold.results_gateway.model.RuleHit;

/**
 * Keeps only content relevant to OSD customers.
 */
public final class AudiencePolicy implements RulePolicy {

    private static final AudiencePolicy OSD_ELIGIBLE_ONLY = new AudiencePolicy();

    private AudiencePolicy() {
    }

    public static AudiencePolicy osdEligibleOnly() {
        return OSD_ELIGIBLE_ONLY;
    }

    @Override
    public boolean admits(RuleHit hit, RuleContent content) {
        return content.osdCustomer();
    }

    @Override
    public String toString() {
        return "AudiencePolicy[osdEligibleOnly]";
    }
}
