package tech.noetzold.results_gateway.proxy;

import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import tech.noetzold.results_gateway.config.GatewayProperties;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Builds handlers that forward the current request to one backend, passing it
 * through the configured modifier chains.
 */
@Slf4j
@Component
public class ProxyDispatcher {

    private final RestTemplate restTemplate;
    private final BackendEndpoints endpoints;
    private final String apiPrefix;

    public ProxyDispatcher(RestTemplate restTemplate, BackendEndpoints endpoints, GatewayProperties properties) {
        this.restTemplate = restTemplate;
        this.endpoints = endpoints;
        this.apiPrefix = properties.getApiPrefix();
    }

    public ProxyHandler proxyTo(Backend backend, ProxyOptions options) {
        String baseUrl = endpoints.baseUrlOf(backend);
        ProxyOptions chains = options != null ? options : ProxyOptions.none();

        return (request, response) -> {
            ProxyRequest proxyRequest = modifyRequest(chains.requestModifiers(), ProxyRequest.from(request, apiPrefix));

            URI target = composeEndpoint(baseUrl, proxyRequest);
            log.info("Proxying {} {} to {}", proxyRequest.method(), request.getRequestURI(), backend);

            ProxyResponse upstream = send(backend, target, proxyRequest);
            write(modifyResponse(chains.responseModifiers(), upstream), response);
        };
    }

    static ProxyRequest modifyRequest(List<RequestModifier> modifiers, ProxyRequest request) {
        ProxyRequest current = request;
        for (RequestModifier modifier : modifiers) {
            current = modifier.modify(current);
        }
        return current;
    }

    static ProxyResponse modifyResponse(List<ResponseModifier> modifiers, ProxyResponse response) {
        ProxyResponse current = response;
        for (ResponseModifier modifier : modifiers) {
            current = modifier.modify(current);
        }
        return current;
    }

    private URI composeEndpoint(String baseUrl, ProxyRequest request) {
        String query = request.query() != null && !request.query().isEmpty() ? "?" + request.query() : "";
        return URI.create(baseUrl + request.path() + query);
    }

    private ProxyResponse send(Backend backend, URI target, ProxyRequest request) {
        log.debug("Connecting to {}", target);
        byte[] body = request.body() != null && request.body().length > 0 ? request.body() : null;
        HttpEntity<byte[]> entity = new HttpEntity<>(body, request.headers());

        try {
            ResponseEntity<byte[]> resp = restTemplate.exchange(target, request.method(), entity, byte[].class);
            return new ProxyResponse(resp.getStatusCode(), resp.getHeaders(), resp.getBody());
        } catch (HttpStatusCodeException ex) {
            HttpHeaders headers = ex.getResponseHeaders() != null ? ex.getResponseHeaders() : new HttpHeaders();
            return new ProxyResponse(ex.getStatusCode(), headers, ex.getResponseBodyAsByteArray());
        } catch (ResourceAccessException ex) {
            log.error("Error during retrieve of {}", target, ex);
            throw backend.unavailable(ex);
        }
    }

    private void write(ProxyResponse proxyResponse, HttpServletResponse response) throws IOException {
        response.setStatus(proxyResponse.status().value());
        MediaType contentType = proxyResponse.headers() != null ? proxyResponse.headers().getContentType() : null;
        if (contentType != null) {
            response.setContentType(contentType.toString());
        }
        byte[] body = proxyResponse.body();
        if (body != null && body.length > 0) {
            response.getOutputStream().write(body);
        }
        response.flushBuffer();
    }
}
