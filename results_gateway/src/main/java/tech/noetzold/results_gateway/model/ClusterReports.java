package tech.noetzold.results_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Reports for a list of clusters, kept in the shape the aggregator produces.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterReports(
        @JsonProperty("clusters") List<String> clusters,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("reports") Map<String, JsonNode> reports,
        @JsonProperty("generated_at") String generatedAt,
        @JsonProperty("status") String status
) {}
