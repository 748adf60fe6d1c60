package tech.noetzold.results_gateway.proxy;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.servlet.HandlerMapping;
import tech.noetzold.results_gateway.IdentityInterceptor;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static tech.noetzold.results_gateway.TestData.CLUSTER_ID;
import static tech.noetzold.results_gateway.TestData.IDENTITY;

class ProxyRequestTest {

    @Test
    void capturesPathVariablesHeadersAndIdentity() throws Exception {
        MockHttpServletRequest servletRequest =
                new MockHttpServletRequest("PUT", "/api/v1/clusters/" + CLUSTER_ID + "/rules/r1/enable");
        servletRequest.setQueryString("a=1");
        servletRequest.addHeader("Accept", "application/json");
        servletRequest.addHeader("Connection", "keep-alive");
        servletRequest.setContent("{}".getBytes());
        servletRequest.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE,
                Map.of("cluster", CLUSTER_ID, "rule_id", "r1"));
        servletRequest.setAttribute(IdentityInterceptor.IDENTITY_ATTRIBUTE, IDENTITY);

        ProxyRequest request = ProxyRequest.from(servletRequest, "/api/v1");

        assertEquals(HttpMethod.PUT, request.method());
        assertEquals("/clusters/" + CLUSTER_ID + "/rules/r1/enable", request.path());
        assertEquals("a=1", request.query());
        assertEquals(Map.of("cluster", CLUSTER_ID, "rule_id", "r1"), request.pathVariables());
        assertEquals("application/json", request.headers().getFirst("Accept"));
        assertFalse(request.headers().containsKey("Connection"));
        assertArrayEquals("{}".getBytes(), request.body());
        assertSame(IDENTITY, request.identity());
    }

    @Test
    void nonStringPathVariablesAreCopiedAsText() throws Exception {
        Map<Object, Object> variables = new HashMap<>();
        variables.put("org_id", 7L);
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/api/v1/organizations/7");
        servletRequest.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, variables);

        ProxyRequest request = ProxyRequest.from(servletRequest, "/api/v1");

        assertEquals("7", request.pathVariables().get("org_id"));
        assertThrows(UnsupportedOperationException.class, () -> request.pathVariables().put("x", "y"));
    }

    @Test
    void missingPathVariablesGiveEmptyMap() throws Exception {
        ProxyRequest request = ProxyRequest.from(new MockHttpServletRequest("GET", "/api/v1/rule"), "/api/v1");

        assertTrue(request.pathVariables().isEmpty());
        assertNull(request.identity());
    }
}
