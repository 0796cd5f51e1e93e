package warden.core.exception;

/**
 * Transport failure reaching the upstream provider (connection refused, timeout, cancellation).
 */
public class UpstreamUnreachableException extends ConnectorException {

    public UpstreamUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
