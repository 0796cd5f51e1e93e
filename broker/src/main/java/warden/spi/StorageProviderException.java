package warden.spi;

import warden.core.exception.StorageException;

/**
 * A storage backend could not be selected or started: unknown provider name, pool creation or
 * schema migration failure. Startup aborts on it.
 */
public class StorageProviderException extends StorageException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
