package tech.noetzold.results_gateway.exception;

public class AuthenticationException extends GatewayException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
