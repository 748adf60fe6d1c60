package tech.noetzold.results_gateway.exception;

public class PermissionDeniedException extends GatewayException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
