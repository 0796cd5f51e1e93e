package warden.core.exception;

/**
 * A row with the same primary key already exists.
 */
public class StorageAlreadyExistsException extends StorageException {

    public StorageAlreadyExistsException(String entity, String id) {
        super("%s %s already exists".formatted(entity, id));
    }

    public StorageAlreadyExistsException(String message, Throwable cause) {
        super(message, cause);
    }
}
