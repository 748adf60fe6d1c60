package tech.noetzold.results_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportMetainfo(
        @JsonProperty("count") int count,
        @JsonProperty("last_checked_at") String lastCheckedAt,
        @JsonProperty("stored_at") String storedAt
) {}
