package tech.noetzold.results_gateway.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import tech.noetzold.results_gateway.exception.UpstreamDecodeException;
import tech.noetzold.results_gateway.exception.UpstreamResponseException;
import tech.noetzold.results_gateway.model.RuleContent;
import tech.noetzold.results_gateway.model.RuleGroup;
import tech.noetzold.results_gateway.proxy.Backend;
import tech.noetzold.results_gateway.proxy.BackendEndpoints;

import java.io.IOException;
import java.net.URI;
import java.util.List;

@Slf4j
@Service
public class ContentServiceClient {

    static final String CONTENT_ENDPOINT = "/content";
    static final String GROUPS_ENDPOINT = "/groups";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public ContentServiceClient(RestTemplate restTemplate, ObjectMapper objectMapper, BackendEndpoints endpoints) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = endpoints.baseUrlOf(Backend.CONTENT);
    }

    public List<RuleContent> fetchRuleContent() {
        byte[] body = get(URI.create(baseUrl + CONTENT_ENDPOINT));
        try {
            List<RuleContent> rules = objectMapper.readValue(body, new TypeReference<List<RuleContent>>() {});
            return rules != null ? rules : List.of();
        } catch (IOException e) {
            throw new UpstreamDecodeException("Unable to decode rule content", e);
        }
    }

    public List<RuleGroup> fetchRuleGroups() {
        byte[] body = get(URI.create(baseUrl + GROUPS_ENDPOINT));
        try {
            GroupsEnvelope envelope = objectMapper.readValue(body, GroupsEnvelope.class);
            if (envelope == null || envelope.groups() == null) {
                throw new UpstreamDecodeException("Content service returned no groups", null);
            }
            return envelope.groups();
        } catch (IOException e) {
            throw new UpstreamDecodeException("Unable to decode rule groups", e);
        }
    }

    private byte[] get(URI uri) {
        try {
            byte[] body = restTemplate.getForObject(uri, byte[].class);
            return body != null ? body : new byte[0];
        } catch (HttpStatusCodeException ex) {
            log.warn("Content service answered {} for {}", ex.getStatusCode().value(), uri);
            MediaType contentType = ex.getResponseHeaders() != null ? ex.getResponseHeaders().getContentType() : null;
            throw new UpstreamResponseException(ex.getStatusCode(), ex.getResponseBodyAsByteArray(), contentType);
        } catch (ResourceAccessException ex) {
            log.error("Problem connecting to content service at {}", uri, ex);
            throw Backend.CONTENT.unavailable(ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GroupsEnvelope(String status, List<RuleGroup> groups) {}
}
