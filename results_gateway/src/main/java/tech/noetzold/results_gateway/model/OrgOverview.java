package tech.noetzold.results_gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record OrgOverview(
        @JsonProperty("clusters_hit") int clustersHit,
        @JsonProperty("hit_by_risk") Map<Integer, Integer> hitByRisk,
        @JsonProperty("hit_by_tag") Map<String, Integer> hitByTag
) {}
