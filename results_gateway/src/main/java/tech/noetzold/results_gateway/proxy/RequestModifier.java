package tech.noetzold.results_gateway.proxy;

/**
 * Rewrites a request before it is forwarded. Throwing stops the chain and the
 * error is answered to the client instead.
 */
@FunctionalInterface
public interface RequestModifier {

    ProxyRequest modify(ProxyRequest request);
}
