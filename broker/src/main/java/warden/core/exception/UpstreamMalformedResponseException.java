package warden.core.exception;

/**
 * The upstream provider answered, but with an unexpected status or an undecodable body.
 */
public class UpstreamMalformedResponseException extends ConnectorException {

    private final int statusCode;

    public UpstreamMalformedResponseException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamMalformedResponseException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the offending response, or -1 when the body could not be decoded.
     */
    public int statusCode() {
        return statusCode;
    }
}
