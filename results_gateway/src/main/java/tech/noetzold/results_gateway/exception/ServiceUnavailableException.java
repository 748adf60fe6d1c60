package tech.noetzold.results_gateway.exception;

import tech.noetzold.results_gateway.proxy.Backend;

/**
 * A backend could not be reached at the transport level (connection refused,
 * unknown host, timeout).
 */
public class ServiceUnavailableException extends GatewayException {

    private final Backend backend;

    public ServiceUnavailableException(Backend backend, Throwable cause) {
        super(backend.getDisplayName() + " service is unavailable", cause);
        this.backend = backend;
    }

    public Backend getBackend() {
        return backend;
    }
}
