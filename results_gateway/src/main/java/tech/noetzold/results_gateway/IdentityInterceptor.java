package tech.noetzold.results_gateway;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import tech.noetzold.results_gateway.identity.Identity;
import tech.noetzold.results_gateway.identity.IdentityResolver;

/**
 * Resolves the caller identity before organization scoped handlers run and keeps it
 * as a request attribute.
 */
@Component
public class IdentityInterceptor implements HandlerInterceptor {

    public static final String IDENTITY_ATTRIBUTE = "gateway.identity";

    private final IdentityResolver identityResolver;

    public IdentityInterceptor(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        Identity identity = identityResolver.resolve(request);
        request.setAttribute(IDENTITY_ATTRIBUTE, identity);
        return true;
    }
}
