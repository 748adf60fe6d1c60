package tech.noetzold.results_gateway.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /** Prefix under which the client-facing API is served. */
    @NotBlank
    private String apiPrefix = "/api/v1";

    @NotBlank
    private String aggregatorBaseEndpoint = "http://localhost:8080/api/v1";

    @NotBlank
    private String contentBaseEndpoint = "http://localhost:8082/api/v1";

    /** Read the cluster list from the aggregator when AMS is missing or failing. */
    private boolean useOrgClustersFallback = true;

    private boolean enableInternalRulesOrganizations = false;

    private List<Long> internalRulesOrganizations = new ArrayList<>();

    private Duration connectTimeout = Duration.ofSeconds(3);

    private Duration readTimeout = Duration.ofSeconds(10);

    private Ams ams = new Ams();

    private Content content = new Content();

    @Data
    public static class Ams {
        /** Base URL of the membership service; AMS resolution is off when blank. */
        private String url = "";
        private String token = "";
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Content {
        private long refreshIntervalMs = 60_000;
        private long waitTimeoutMs = 5_000;
    }
}
