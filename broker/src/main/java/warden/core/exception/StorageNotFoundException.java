package warden.core.exception;

/**
 * The requested row does not exist.
 */
public class StorageNotFoundException extends StorageException {

    public StorageNotFoundException(String entity, String id) {
        super("%s %s not found".formatted(entity, id));
    }
}
