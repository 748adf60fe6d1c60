package tech.noetzold.results_gateway.exception;

public class MembershipServiceException extends GatewayException {

    public MembershipServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
