package tech.noetzold.results_gateway.model;

import java.util.List;
import java.util.Map;

/**
 * Clusters of one organization at resolution time, with a display name for each
 * cluster id. Display names are empty when the source has none.
 */
public record ClusterSet(
        List<ClusterInfo> clusters,
        Map<String, String> displayNames
) {

    public List<String> ids() {
        return clusters.stream().map(ClusterInfo::id).toList();
    }
}
