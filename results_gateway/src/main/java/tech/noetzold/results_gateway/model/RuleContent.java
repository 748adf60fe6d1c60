package tech.noetzold.results_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Descriptive metadata of a (rule, error key) pair served by the content service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleContent(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("error_key") String errorKey,
        @JsonProperty("description") String description,
        @JsonProperty("generic") String generic,
        @JsonProperty("reason") String reason,
        @JsonProperty("resolution") String resolution,
        @JsonProperty("more_info") String moreInfo,
        @JsonProperty("total_risk") int totalRisk,
        @JsonProperty("risk_of_change") int riskOfChange,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("internal") boolean internal,
        @JsonProperty("osd_customer") boolean osdCustomer,
        @JsonProperty("publish_date") String publishDate
) {

    public List<String> tagList() {
        return tags != null ? tags : List.of();
    }
}
