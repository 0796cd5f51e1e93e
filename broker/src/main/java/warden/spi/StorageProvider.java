package warden.spi;

import java.util.Optional;

import warden.core.port.out.Storage;
import warden.core.port.out.StorageHealthIndicator;

/**
 * Service Provider Interface for storage backends.
 *
 * <p>Implementations are discovered via java.util.ServiceLoader at startup.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface and {@link Storage}</li>
 *   <li>Create META-INF/services/warden.spi.StorageProvider</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Configure: warden.storage.provider=your-provider-name</li>
 * </ol>
 *
 * <p>Every backend must pass the shared storage contract test suite.
 */
public interface StorageProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: warden.storage.provider={name}
     */
    String name();

    default String description() {
        return name() + " storage provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values win. Built-in providers use memory: 0, sql: 10.
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider can be used (driver present, required settings configured).
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the storage implementation. Called once at startup; the result must be thread-safe.
     *
     * @param config access to configuration properties
     * @throws StorageProviderException if initialization fails
     */
    Storage createStorage(StorageAdapterConfig config);

    /**
     * Optionally provide a health indicator for this backend.
     */
    default Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.empty();
    }
}
