package tech.noetzold.results_gateway.identity;

import jakarta.servlet.http.HttpServletRequest;
import tech.noetzold.results_gateway.exception.AuthenticationException;

public interface IdentityResolver {

    Identity resolve(HttpServletRequest request) throws AuthenticationException;
}
