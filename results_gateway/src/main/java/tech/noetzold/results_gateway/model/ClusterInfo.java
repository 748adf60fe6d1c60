package tech.noetzold.results_gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ClusterInfo(
        @JsonProperty("cluster_id") String id,
        @JsonProperty("display_name") String displayName
) {}
