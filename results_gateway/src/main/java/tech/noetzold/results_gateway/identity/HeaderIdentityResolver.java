package tech.noetzold.results_gateway.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import tech.noetzold.results_gateway.exception.AuthenticationException;

import java.io.IOException;
import java.util.Base64;

/**
 * Reads the identity from the base64 encoded JSON {@code x-rh-identity} header set
 * by the authenticating front proxy.
 */
@Component
public class HeaderIdentityResolver implements IdentityResolver {

    public static final String IDENTITY_HEADER = "x-rh-identity";

    private final ObjectMapper objectMapper;

    public HeaderIdentityResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Identity resolve(HttpServletRequest request) {
        String header = request.getHeader(IDENTITY_HEADER);
        if (header == null || header.isBlank()) {
            throw new AuthenticationException("Missing auth token");
        }

        JsonNode identity;
        try {
            byte[] decoded = Base64.getDecoder().decode(header.trim());
            identity = objectMapper.readTree(decoded).path("identity");
        } catch (IllegalArgumentException | IOException e) {
            throw new AuthenticationException("Malformed auth token", e);
        }

        JsonNode orgId = identity.path("org_id");
        if (!orgId.canConvertToLong() && !orgId.isTextual()) {
            throw new AuthenticationException("Auth token does not contain an organization ID");
        }

        long org = parseOrgId(orgId);
        JsonNode internalOrgId = identity.path("internal").path("org_id");
        long internalOrg = internalOrgId.isMissingNode() || internalOrgId.isNull() ? org : parseOrgId(internalOrgId);

        return new Identity(identity.path("account_number").asText(""), org, internalOrg);
    }

    private long parseOrgId(JsonNode node) {
        try {
            return node.isTextual() ? Long.parseLong(node.asText().trim()) : node.asLong();
        } catch (NumberFormatException e) {
            throw new AuthenticationException("Organization ID is not a number", e);
        }
    }
}
