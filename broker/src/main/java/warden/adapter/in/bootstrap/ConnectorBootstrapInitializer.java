package warden.adapter.in.bootstrap;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.ConnectorsConfig;
import warden.core.exception.ConfigurationException;
import warden.core.exception.StorageAlreadyExistsException;
import warden.core.model.storage.ConnectorEntry;
import warden.core.port.out.Storage;
import warden.core.service.connector.ConnectorRegistry;
import warden.core.util.SecureHash;

/**
 * Writes statically configured connectors to storage on application startup.
 *
 * <p>Connectors that already exist are overwritten with the configured definition. The
 * resource version is derived from the definition, so an unchanged definition keeps cached
 * connector instances valid.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>Unknown connector type: startup FAILS</li>
 *   <li>Storage unavailable: startup FAILS</li>
 * </ul>
 */
@ApplicationScoped
public class ConnectorBootstrapInitializer {

    private static final Logger LOG = Logger.getLogger(ConnectorBootstrapInitializer.class);

    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final ConnectorsConfig config;
    private final Storage storage;
    private final ConnectorRegistry registry;

    @Inject
    public ConnectorBootstrapInitializer(ConnectorsConfig config, Storage storage, ConnectorRegistry registry) {
        this.config = config;
        this.storage = storage;
        this.registry = registry;
    }

    void onStart(@Observes StartupEvent event) {
        final var definitions = config.definitions();
        if (definitions.isEmpty()) {
            LOG.debug("No static connectors configured");
            return;
        }

        LOG.infof("Bootstrapping %d static connectors", definitions.size());
        bootstrap().await().atMost(STARTUP_TIMEOUT);
    }

    /**
     * Create or overwrite every configured connector.
     */
    public Uni<Void> bootstrap() {
        final var entries = new ArrayList<ConnectorEntry>();
        config.definitions().forEach((id, definition) -> entries.add(toEntry(id, definition)));

        return Multi.createFrom()
                .iterable(entries)
                .onItem()
                .transformToUniAndConcatenate(this::store)
                .collect()
                .last()
                .replaceWithVoid();
    }

    ConnectorEntry toEntry(String id, ConnectorsConfig.Definition definition) {
        if (!registry.supportedTypes().contains(definition.type())) {
            throw new ConfigurationException("connector %s has unknown type \"%s\", expected one of %s"
                    .formatted(id, definition.type(), registry.supportedTypes()));
        }
        final var name = definition.name().orElse(id);
        final var json = definition.config();
        final var version = SecureHash.sha256Hex(definition.type() + "\n" + name + "\n" + json);
        return new ConnectorEntry(id, definition.type(), name, version, json.getBytes(StandardCharsets.UTF_8));
    }

    private Uni<Void> store(ConnectorEntry entry) {
        return storage.createConnector(entry)
                .invoke(() -> LOG.infof("Created connector %s (type %s)", entry.id(), entry.type()))
                .onFailure(StorageAlreadyExistsException.class)
                .recoverWithUni(() -> storage.updateConnector(entry.id(), existing -> entry)
                        .invoke(() -> LOG.infof("Updated connector %s (type %s)", entry.id(), entry.type()))
                        .replaceWithVoid())
                .onFailure()
                .invoke(e -> LOG.errorf(e, "Failed to bootstrap connector %s", entry.id()));
    }
}
