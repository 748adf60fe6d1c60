package tech.noetzold.results_gateway.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tech.noetzold.results_gateway.config.GatewayProperties;

import java.util.Set;

/**
 * Organizations allowed to see internal rules. Nobody is when the feature is off.
 */
@Slf4j
@Component
public class InternalRuleAccess {

    private final boolean enabled;
    private final Set<Long> allowedOrganizations;

    @Autowired
    public InternalRuleAccess(GatewayProperties properties) {
        this(properties.isEnableInternalRulesOrganizations(), Set.copyOf(properties.getInternalRulesOrganizations()));
    }

    public InternalRuleAccess(boolean enabled, Set<Long> allowedOrganizations) {
        this.enabled = enabled;
        this.allowedOrganizations = Set.copyOf(allowedOrganizations);
    }

    public boolean isPermitted(long orgId) {
        boolean permitted = enabled && allowedOrganizations.contains(orgId);
        log.debug("Organization {} internal rules access: {}", orgId, permitted);
        return permitted;
    }

    public InternalRulePolicy policyFor(long orgId) {
        return new InternalRulePolicy(isPermitted(orgId));
    }
}
