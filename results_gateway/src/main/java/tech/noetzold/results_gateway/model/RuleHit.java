package tech.noetzold.results_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One rule evaluation result for a cluster, as stored by the aggregator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleHit(
        @JsonProperty("component") String component,
        @JsonProperty("key") String key,
        @JsonProperty("user_vote") Integer userVote,
        @JsonProperty("disabled") boolean disabled,
        @JsonProperty("disable_feedback") String disableFeedback,
        @JsonProperty("disabled_at") String disabledAt,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("details") JsonNode details
) {

    public String selector() {
        return component + "|" + key;
    }
}
