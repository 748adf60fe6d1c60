package tech.noetzold.results_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterReport(
        @JsonProperty("meta") ReportMeta meta,
        @JsonProperty("reports") List<RuleHit> reports
) {

    public List<RuleHit> hits() {
        return reports != null ? reports : List.of();
    }
}
