package warden.core.exception;

/**
 * Backend failure that maps to neither {@link StorageNotFoundException} nor
 * {@link StorageAlreadyExistsException}.
 */
public class StorageException extends BrokerException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
