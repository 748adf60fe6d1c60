package tech.noetzold.results_gateway.proxy;

import org.springframework.stereotype.Component;
import tech.noetzold.results_gateway.config.GatewayProperties;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Base URL of every {@link Backend}, fixed when the application context starts.
 */
@Component
public class BackendEndpoints {

    private final Map<Backend, String> baseUrls;

    public BackendEndpoints(GatewayProperties properties) {
        Map<Backend, String> urls = new EnumMap<>(Backend.class);
        urls.put(Backend.AGGREGATOR, trimTrailingSlash(properties.getAggregatorBaseEndpoint()));
        urls.put(Backend.CONTENT, trimTrailingSlash(properties.getContentBaseEndpoint()));
        this.baseUrls = Collections.unmodifiableMap(urls);
    }

    public String baseUrlOf(Backend backend) {
        return baseUrls.get(backend);
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
