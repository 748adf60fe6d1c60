package tech.noetzold.results_gateway.exception;

import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;

/**
 * A backend answered with a non-success status. The status and body are sent to
 * the client unchanged.
 */
public class UpstreamResponseException extends GatewayException {

    private final HttpStatusCode statusCode;
    private final byte[] body;
    private final MediaType contentType;

    public UpstreamResponseException(HttpStatusCode statusCode, byte[] body, MediaType contentType) {
        super("Upstream responded with status " + statusCode.value());
        this.statusCode = statusCode;
        this.body = body != null ? body : new byte[0];
        this.contentType = contentType;
    }

    public HttpStatusCode getStatusCode() {
        return statusCode;
    }

    public byte[] getBody() {
        return body;
    }

    public MediaType getContentType() {
        return contentType;
    }
}
