package warden.adapter.out.storage.memory;

import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.OfflineSessionKey;
import warden.core.model.storage.StorageHealth;
import warden.core.port.out.Storage;
import warden.core.port.out.StorageHealthIndicator;
import warden.spi.StorageAdapterConfig;
import warden.spi.StorageProvider;

/**
 * Process-local storage, selected when no database is configured.
 *
 * <p>Nothing survives a restart and nothing is shared between instances, so each instance
 * rotates its own signing keys and refresh tokens only redeem where they were issued.
 */
public class InMemoryStorageProvider implements StorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);

    static final String NAME = "memory";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Process-local storage (lost on restart, not shared between instances)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public Storage createStorage(StorageAdapterConfig config) {
        LOG.warn("Using in-memory storage: run a single instance or configure warden.storage.sql.jdbc-url");
        return new InMemoryStorage(new OfflineSessionKey(config.offlineSessionKeyAlgorithm()));
    }

    @Override
    public Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.of(() -> Uni.createFrom().item(StorageHealth.up(NAME, 0)));
    }
}
