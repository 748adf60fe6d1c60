package tech.noetzold.results_gateway.identity;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import tech.noetzold.results_gateway.exception.AuthenticationException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class HeaderIdentityResolverTest {

    private final HeaderIdentityResolver resolver = new HeaderIdentityResolver(new ObjectMapper());

    private static MockHttpServletRequest withIdentity(String json) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(HeaderIdentityResolver.IDENTITY_HEADER,
                Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8)));
        return request;
    }

    @Test
    void resolvesIdentity() {
        Identity identity = resolver.resolve(withIdentity(
                "{\"identity\":{\"account_number\":\"6278\",\"org_id\":\"11789772\",\"internal\":{\"org_id\":\"1\"}}}"));

        assertEquals(new Identity("6278", 11789772L, 1L), identity);
    }

    @Test
    void internalOrgIdDefaultsToOrgId() {
        Identity identity = resolver.resolve(withIdentity("{\"identity\":{\"account_number\":\"1\",\"org_id\":5}}"));

        assertEquals(5L, identity.internalOrgId());
    }

    @Test
    void missingHeaderIsRejected() {
        assertThrows(AuthenticationException.class, () -> resolver.resolve(new MockHttpServletRequest()));
    }

    @Test
    void malformedHeaderIsRejected() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(HeaderIdentityResolver.IDENTITY_HEADER, "%%%not-base64");

        assertThrows(AuthenticationException.class, () -> resolver.resolve(request));
    }

    @Test
    void missingOrgIdIsRejected() {
        assertThrows(AuthenticationException.class,
                () -> resolver.resolve(withIdentity("{\"identity\":{\"account_number\":\"1\"}}")));
    }
}
