package tech.noetzold.results_gateway.proxy;

import tech.noetzold.results_gateway.exception.ServiceUnavailableException;

/**
 * Backends the gateway forwards to. Each one owns the error reported when it
 * cannot be reached.
 */
public enum Backend {

    AGGREGATOR("Aggregator"),
    CONTENT("Content");

    private final String displayName;

    Backend(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public ServiceUnavailableException unavailable(Throwable cause) {
        return new ServiceUnavailableException(this, cause);
    }
}
