package tech.noetzold.results_gateway.exception;

public class IdentityServiceUnavailableException extends GatewayException {

    public IdentityServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
