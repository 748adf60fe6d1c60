package tech.noetzold.results_gateway.exception;

/**
 * Base type of every failure the gateway classifies before answering a client.
 * Each subclass is translated to exactly one HTTP response by {@code ErrorHandler}.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
