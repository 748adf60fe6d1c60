package tech.noetzold.results_gateway.exception;

/**
 * A backend answered with a success status but a body that does not match the
 * expected JSON shape.
 */
public class UpstreamDecodeException extends GatewayException {

    public UpstreamDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
