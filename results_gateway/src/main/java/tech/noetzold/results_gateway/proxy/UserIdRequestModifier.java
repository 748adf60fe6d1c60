package tech.noetzold.results_gateway.proxy;

import org.springframework.web.util.UriComponentsBuilder;
import tech.noetzold.results_gateway.exception.AuthenticationException;
import tech.noetzold.results_gateway.exception.BadRequestException;

import java.util.HashMap;
import java.util.Map;

/**
 * Rewrites the request path to {@code endpointTemplate}, taking {@code {user_id}} from
 * the caller's account number and every other placeholder from the path variables
 * of the inbound request.
 */
public class UserIdRequestModifier implements RequestModifier {

    public static final String USER_ID_VARIABLE = "user_id";

    private final String endpointTemplate;

    public UserIdRequestModifier(String endpointTemplate) {
        this.endpointTemplate = endpointTemplate.startsWith("/") ? endpointTemplate : "/" + endpointTemplate;
    }

    @Override
    public ProxyRequest modify(ProxyRequest request) {
        if (request.identity() == null) {
            throw new AuthenticationException("Missing auth token");
        }

        Map<String, String> variables = new HashMap<>(request.pathVariables());
        variables.put(USER_ID_VARIABLE, request.identity().accountNumber());

        try {
            String path = UriComponentsBuilder.fromPath(endpointTemplate)
                    .encode()
                    .buildAndExpand(variables)
                    .getPath();
            return request.withPath(path);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Unable to compose endpoint " + endpointTemplate + ": " + e.getMessage());
        }
    }
}
