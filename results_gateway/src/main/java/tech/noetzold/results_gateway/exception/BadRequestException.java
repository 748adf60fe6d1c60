package tech.noetzold.results_gateway.exception;

public class BadRequestException extends GatewayException {

    public BadRequestException(String message) {
        super(message);
    }
}
