package warden.core.exception;

/**
 * Failure while talking to, or applying policy on top of, an upstream identity provider.
 */
public abstract class ConnectorException extends BrokerException {

    protected ConnectorException(String message) {
        super(message);
    }

    protected ConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
