package tech.noetzold.results_gateway.exception;

/**
 * The rule content directory did not become available in time. Always fatal to
 * the current call.
 */
public class ContentServiceTimeoutException extends GatewayException {

    public ContentServiceTimeoutException(String message) {
        super(message);
    }
}
