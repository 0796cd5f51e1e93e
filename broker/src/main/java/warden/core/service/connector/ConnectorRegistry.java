package warden.core.service.connector;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.exception.ConfigurationException;
import warden.core.model.storage.ConnectorEntry;
import warden.core.port.out.Storage;
import warden.spi.Connector;
import warden.spi.ConnectorFactory;

/**
 * Opens connectors by id from their stored definitions.
 *
 * <p>Factories are discovered via CDI and matched on {@link ConnectorFactory#type()}.
 * Opened connectors are cached by id and reopened when the stored definition's
 * resource version changes.
 */
@ApplicationScoped
public class ConnectorRegistry {

    private static final Logger LOG = Logger.getLogger(ConnectorRegistry.class);

    private final Instance<ConnectorFactory> factories;
    private final Storage storage;
    private final Map<String, OpenedConnector> opened = new ConcurrentHashMap<>();

    private volatile Map<String, ConnectorFactory> factoriesByType;

    @Inject
    public ConnectorRegistry(Instance<ConnectorFactory> factories, Storage storage) {
        this.factories = factories;
        this.storage = storage;
    }

    /**
     * Load the connector definition from storage and return an open connector for it.
     *
     * <p>Fails with {@link warden.core.exception.StorageNotFoundException} when no connector
     * with that id is stored, and with {@link ConfigurationException} when its type is unknown
     * or its configuration is invalid.
     */
    public Uni<Connector> get(String connectorId) {
        return storage.getConnector(connectorId).map(this::open);
    }

    /**
     * Types for which a factory is available.
     */
    public Set<String> supportedTypes() {
        return factoriesByType().keySet();
    }

    /**
     * Forget the cached connector, forcing the next lookup to reopen it.
     */
    public void evict(String connectorId) {
        if (opened.remove(connectorId) != null) {
            LOG.debugv("Evicted connector {0}", connectorId);
        }
    }

    Connector open(ConnectorEntry entry) {
        final var cached = opened.get(entry.id());
        if (cached != null && cached.resourceVersion().equals(entry.resourceVersion())) {
            return cached.connector();
        }

        final var factory = factoriesByType().get(entry.type());
        if (factory == null) {
            throw new ConfigurationException(
                    "unknown connector type \"%s\" for connector %s".formatted(entry.type(), entry.id()));
        }

        final var connector = factory.open(entry.id(), entry.config());
        opened.put(entry.id(), new OpenedConnector(entry.resourceVersion(), connector));
        if (cached == null) {
            LOG.infof("Opened connector %s (type %s)", entry.id(), entry.type());
        } else {
            LOG.infof("Reopened connector %s after its definition changed", entry.id());
        }
        return connector;
    }

    private Map<String, ConnectorFactory> factoriesByType() {
        var result = factoriesByType;
        if (result == null) {
            synchronized (this) {
                result = factoriesByType;
                if (result == null) {
                    result = indexFactories();
                    factoriesByType = result;
                }
            }
        }
        return result;
    }

    private Map<String, ConnectorFactory> indexFactories() {
        final var byType = new HashMap<String, ConnectorFactory>();
        for (var factory : factories) {
            final var previous = byType.putIfAbsent(factory.type(), factory);
            if (previous != null) {
                LOG.warnf(
                        "Ignoring connector factory %s: type %s is already handled by %s",
                        factory.getClass().getName(),
                        factory.type(),
                        previous.getClass().getName());
            }
        }
        LOG.debugf("Available connector types: %s", byType.keySet());
        return Map.copyOf(byType);
    }

    private record OpenedConnector(String resourceVersion, Connector connector) {}
}
