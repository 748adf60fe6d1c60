package tech.noetzold.results_gateway.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for the {@code {"status": ..., "<key>": data}} envelope every endpoint answers with.
 */
public final class ApiResponse {

    public static final String STATUS_OK = "ok";

    private ApiResponse() {
    }

    public static Map<String, Object> ok(String key, Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", STATUS_OK);
        body.put(key, data);
        return body;
    }

    public static Map<String, Object> status(String status) {
        return Map.of("status", status);
    }
}
