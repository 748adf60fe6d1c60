package tech.noetzold.results_gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnrichedRule {

    @JsonProperty("rule_id")
    private String ruleId;

    @JsonProperty("error_key")
    private String errorKey;

    @JsonProperty("created_at")
    private String createdAt;

    private String description;
    private String generic;
    private String reason;
    private String resolution;

    @JsonProperty("more_info")
    private String moreInfo;

    @JsonProperty("total_risk")
    private int totalRisk;

    @JsonProperty("risk_of_change")
    private int riskOfChange;

    private boolean disabled;

    @JsonProperty("disable_feedback")
    private String disableFeedback;

    @JsonProperty("disabled_at")
    private String disabledAt;

    private boolean internal;

    @JsonProperty("user_vote")
    private Integer userVote;

    @JsonProperty("extra_data")
    private JsonNode extraData;

    private List<String> tags;

    @JsonProperty("publish_date")
    private String publishDate;

    public static EnrichedRule of(RuleHit hit, RuleContent content) {
        return EnrichedRule.builder()
                .ruleId(hit.component())
                .errorKey(hit.key())
                .createdAt(hit.createdAt())
                .description(content.description())
                .generic(content.generic())
                .reason(content.reason())
                .resolution(content.resolution())
                .moreInfo(content.moreInfo())
                .totalRisk(content.totalRisk())
                .riskOfChange(content.riskOfChange())
                .disabled(hit.disabled())
                .disableFeedback(hit.disableFeedback())
                .disabledAt(hit.disabledAt())
                .internal(content.internal())
                .userVote(hit.userVote())
                .extraData(hit.details())
                .tags(content.tagList())
                .publishDate(content.publishDate())
                .build();
    }
}
