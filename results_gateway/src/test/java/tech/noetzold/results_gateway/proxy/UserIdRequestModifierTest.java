package tech.noetzold.results_gateway.proxy;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import tech.noetzold.results_gateway.exception.AuthenticationException;
import tech.noetzold.results_gateway.exception.BadRequestException;
import tech.noetzold.results_gateway.identity.Identity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UserIdRequestModifierTest {

    private static ProxyRequest request(Map<String, String> variables, Identity identity) {
        return new ProxyRequest(HttpMethod.PUT, "/original", null, null, null, variables, identity);
    }

    @Test
    void fillsUserIdAndPathVariables() {
        UserIdRequestModifier modifier = new UserIdRequestModifier("clusters/{cluster}/users/{user_id}/enable");

        ProxyRequest modified = modifier.modify(request(Map.of("cluster", "c1"), new Identity("1234", 1, 1)));

        assertEquals("/clusters/c1/users/1234/enable", modified.path());
    }

    @Test
    void encodesVariableValues() {
        UserIdRequestModifier modifier = new UserIdRequestModifier("/rules/{rule_id}/users/{user_id}");

        ProxyRequest modified = modifier.modify(request(Map.of("rule_id", "a b"), new Identity("1", 1, 1)));

        assertEquals("/rules/a%20b/users/1", modified.path());
    }

    @Test
    void reservedCharactersInValuesAreEscaped() {
        UserIdRequestModifier modifier = new UserIdRequestModifier("/rules/{rule_id}/users/{user_id}");

        ProxyRequest modified = modifier.modify(request(Map.of("rule_id", "a/b,c"), new Identity("../x", 1, 1)));

        assertEquals("/rules/a%2Fb%2Cc/users/..%2Fx", modified.path());
    }

    @Test
    void missingIdentityIsAuthenticationError() {
        UserIdRequestModifier modifier = new UserIdRequestModifier("users/{user_id}");

        assertThrows(AuthenticationException.class, () -> modifier.modify(request(Map.of(), null)));
    }

    @Test
    void unresolvedVariableIsBadRequest() {
        UserIdRequestModifier modifier = new UserIdRequestModifier("clusters/{cluster}/users/{user_id}");

        assertThrows(BadRequestException.class, () -> modifier.modify(request(Map.of(), new Identity("1", 1, 1))));
    }
}
