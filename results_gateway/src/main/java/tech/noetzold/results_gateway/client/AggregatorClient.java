package tech.noetzold.results_gateway.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import tech.noetzold.results_gateway.exception.UpstreamDecodeException;
import tech.noetzold.results_gateway.exception.UpstreamResponseException;
import tech.noetzold.results_gateway.model.ClusterReport;
import tech.noetzold.results_gateway.model.ClusterReports;
import tech.noetzold.results_gateway.model.ReportMetainfo;
import tech.noetzold.results_gateway.model.RuleHit;
import tech.noetzold.results_gateway.proxy.Backend;
import tech.noetzold.results_gateway.proxy.BackendEndpoints;

import java.io.IOException;
import java.net.URI;
import java.util.List;

@Slf4j
@Service
public class AggregatorClient {

    static final String REPORT_ENDPOINT = "/organizations/{org_id}/clusters/{cluster}/users/{user_id}/report";
    static final String REPORT_METAINFO_ENDPOINT = "/organizations/{org_id}/clusters/{cluster}/users/{user_id}/report/info";
    static final String REPORTS_FOR_CLUSTER_LIST_ENDPOINT = "/organizations/{org_id}/clusters/{cluster_list}/reports";
    static final String REPORTS_FOR_CLUSTER_LIST_PAYLOAD_ENDPOINT = "/organizations/{org_id}/clusters/reports";
    static final String RULE_ENDPOINT = "/organizations/{org_id}/clusters/{cluster}/users/{user_id}/rules/{rule_selector}";
    static final String CLUSTERS_FOR_ORGANIZATION_ENDPOINT = "/organizations/{org_id}/clusters";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public AggregatorClient(RestTemplate restTemplate, ObjectMapper objectMapper, BackendEndpoints endpoints) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = endpoints.baseUrlOf(Backend.AGGREGATOR);
    }

    public ClusterReport readReport(long orgId, String clusterId, String userId) {
        URI uri = endpoint(REPORT_ENDPOINT, orgId, clusterId, userId);
        ReportEnvelope envelope = decode(get(uri), ReportEnvelope.class, uri);
        if (envelope.report() == null) {
            throw new UpstreamDecodeException("Aggregator response for " + uri + " has no report", null);
        }
        log.info("Organization {}; cluster {}; {} rule hits returned by aggregator",
                orgId, clusterId, envelope.report().hits().size());
        return envelope.report();
    }

    public ReportMetainfo readReportMetainfo(long orgId, String clusterId, String userId) {
        URI uri = endpoint(REPORT_METAINFO_ENDPOINT, orgId, clusterId, userId);
        MetainfoEnvelope envelope = decode(get(uri), MetainfoEnvelope.class, uri);
        if (envelope.metainfo() == null) {
            throw new UpstreamDecodeException("Aggregator response for " + uri + " has no metainfo", null);
        }
        return envelope.metainfo();
    }

    public ClusterReports readReportsForClusters(long orgId, List<String> clusterIds) {
        URI uri = endpoint(REPORTS_FOR_CLUSTER_LIST_ENDPOINT, orgId, String.join(",", clusterIds));
        ClusterReports reports = decode(get(uri), ClusterReports.class, uri);
        logClusterReports(orgId, reports);
        return reports;
    }

    public ClusterReports readReportsForClustersInBody(long orgId, byte[] requestBody) {
        URI uri = endpoint(REPORTS_FOR_CLUSTER_LIST_PAYLOAD_ENDPOINT, orgId);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ClusterReports reports = decode(exchange(uri, HttpMethod.POST, new HttpEntity<>(requestBody, headers)),
                ClusterReports.class, uri);
        logClusterReports(orgId, reports);
        return reports;
    }

    public RuleHit readRule(long orgId, String clusterId, String userId, String ruleId, String errorKey) {
        URI uri = endpoint(RULE_ENDPOINT, orgId, clusterId, userId, ruleId + "|" + errorKey);
        RuleEnvelope envelope = decode(get(uri), RuleEnvelope.class, uri);
        if (envelope.report() == null) {
            throw new UpstreamDecodeException("Aggregator response for " + uri + " has no rule", null);
        }
        return envelope.report();
    }

    public List<String> readClusterIds(long orgId) {
        log.info("Retrieving cluster IDs of organization {} from aggregator", orgId);
        URI uri = endpoint(CLUSTERS_FOR_ORGANIZATION_ENDPOINT, orgId);
        ClustersEnvelope envelope = decode(get(uri), ClustersEnvelope.class, uri);
        return envelope.clusters() != null ? envelope.clusters() : List.of();
    }

    private URI endpoint(String template, Object... variables) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(template)
                .encode()
                .buildAndExpand(variables)
                .toUri();
    }

    private byte[] get(URI uri) {
        return exchange(uri, HttpMethod.GET, HttpEntity.EMPTY);
    }

    private byte[] exchange(URI uri, HttpMethod method, HttpEntity<?> entity) {
        try {
            ResponseEntity<byte[]> resp = restTemplate.exchange(uri, method, entity, byte[].class);
            return resp.getBody() != null ? resp.getBody() : new byte[0];
        } catch (HttpStatusCodeException ex) {
            log.warn("Aggregator answered {} for {}", ex.getStatusCode().value(), uri);
            MediaType contentType = ex.getResponseHeaders() != null ? ex.getResponseHeaders().getContentType() : null;
            throw new UpstreamResponseException(ex.getStatusCode(), ex.getResponseBodyAsByteArray(), contentType);
        } catch (ResourceAccessException ex) {
            log.error("Problem connecting to aggregator at {}", uri, ex);
            throw Backend.AGGREGATOR.unavailable(ex);
        }
    }

    private <T> T decode(byte[] body, Class<T> type, URI uri) {
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new UpstreamDecodeException("Empty aggregator response for " + uri, null);
            }
            return value;
        } catch (IOException e) {
            throw new UpstreamDecodeException("Unable to decode aggregator response for " + uri, e);
        }
    }

    private void logClusterReports(long orgId, ClusterReports reports) {
        int clusters = reports.clusters() != null ? reports.clusters().size() : 0;
        int errors = reports.errors() != null ? reports.errors().size() : 0;
        log.info("Organization {}; reports for {} clusters returned by aggregator, {} errors", orgId, clusters, errors);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ReportEnvelope(String status, ClusterReport report) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MetainfoEnvelope(String status, ReportMetainfo metainfo) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleEnvelope(String status, RuleHit report) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ClustersEnvelope(String status, List<String> clusters) {}
}
