package tech.noetzold.results_gateway.exception;

public class NotFoundException extends GatewayException {

    public NotFoundException(String message) {
        super(message);
    }
}
