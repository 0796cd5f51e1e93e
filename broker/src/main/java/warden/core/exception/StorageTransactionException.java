package warden.core.exception;

/**
 * A transaction could not be completed or rolled back cleanly.
 *
 * <p>The original failure is kept as the cause and repeated in the message.
 */
public class StorageTransactionException extends StorageException {

    public StorageTransactionException(String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}
