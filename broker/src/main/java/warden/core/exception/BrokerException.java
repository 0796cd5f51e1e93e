package warden.core.exception;

/**
 * Base type for every error the broker core reports to its callers.
 */
public abstract class BrokerException extends RuntimeException {

    protected BrokerException(String message) {
        super(message);
    }

    protected BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
