package tech.noetzold.results_gateway.client;

import tech.noetzold.results_gateway.exception.MembershipServiceException;
import tech.noetzold.results_gateway.model.ClusterSet;

import java.util.List;

/**
 * Organization membership service (AMS): which clusters an organization owns.
 */
public interface MembershipClient {

    String STATUS_DEPROVISIONED = "Deprovisioned";
    String STATUS_ARCHIVED = "Archived";

    ClusterSet clustersForOrg(long orgId, List<String> excludedStatuses) throws MembershipServiceException;
}
