package tech.noetzold.results_gateway.proxy;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.util.StreamUtils;
import org.springframework.web.servlet.HandlerMapping;
import tech.noetzold.results_gateway.IdentityInterceptor;
import tech.noetzold.results_gateway.identity.Identity;

import java.io.IOException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Inbound request as seen by the proxy modifiers. {@code path} is relative to the
 * API prefix and already URL encoded.
 */
public record ProxyRequest(
        HttpMethod method,
        String path,
        String query,
        HttpHeaders headers,
        byte[] body,
        Map<String, String> pathVariables,
        Identity identity
) {

    // Recomputed by the outbound client.
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "host", "content-length", "connection", "transfer-encoding", "keep-alive", "upgrade");

    public ProxyRequest withPath(String newPath) {
        return new ProxyRequest(method, newPath, query, headers, body, pathVariables, identity);
    }

    public static ProxyRequest from(HttpServletRequest request, String apiPrefix) throws IOException {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (apiPrefix != null && path.startsWith(apiPrefix)) {
            path = path.substring(apiPrefix.length());
        }

        HttpHeaders headers = new HttpHeaders();
        Enumeration<String> names = request.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            if (HOP_BY_HOP_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            Enumeration<String> values = request.getHeaders(name);
            while (values.hasMoreElements()) {
                headers.add(name, values.nextElement());
            }
        }

        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        Map<String, String> pathVariables = new HashMap<>();
        if (variables instanceof Map<?, ?> map) {
            map.forEach((name, value) -> pathVariables.put(String.valueOf(name), String.valueOf(value)));
        }

        return new ProxyRequest(
                HttpMethod.valueOf(request.getMethod()),
                path,
                request.getQueryString(),
                headers,
                StreamUtils.copyToByteArray(request.getInputStream()),
                Collections.unmodifiableMap(pathVariables),
                (Identity) request.getAttribute(IdentityInterceptor.IDENTITY_ATTRIBUTE)
        );
    }
}
