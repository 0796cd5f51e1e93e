package warden.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import warden.core.port.out.Storage;
import warden.core.port.out.StorageHealthIndicator;
import warden.spi.StorageAdapterConfig;
import warden.spi.StorageProvider;
import warden.spi.StorageProviderException;

/**
 * Discovers storage providers via ServiceLoader and produces the {@link Storage} bean.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If warden.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class StorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(StorageProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;

    private StorageProvider provider;
    private Storage storage;

    @Inject
    public StorageProviderLoader(
            @ConfigProperty(name = "warden.storage.provider") Optional<String> configuredProvider,
            StorageAdapterConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public Storage storage() {
        final var selected = getProvider();
        LOG.infof("Creating storage from provider: %s (%s)", selected.name(), selected.description());
        storage = selected.createStorage(config);
        return storage;
    }

    @Produces
    @ApplicationScoped
    public List<StorageHealthIndicator> healthIndicators() {
        final var indicators = new ArrayList<StorageHealthIndicator>();
        getProvider().createHealthIndicator(config).ifPresent(indicators::add);
        return indicators;
    }

    @PreDestroy
    void close() {
        if (storage != null) {
            LOG.info("Closing storage");
            storage.close();
        }
    }

    synchronized StorageProvider getProvider() {
        if (provider != null) {
            return provider;
        }

        final var providers = new ArrayList<StorageProvider>();
        ServiceLoader.load(StorageProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d storage provider(s): %s",
                providers.size(),
                providers.stream().map(StorageProvider::name).toList());

        provider = select(providers, configuredProvider.orElse(null));
        return provider;
    }

    static StorageProvider select(List<StorageProvider> providers, String configured) {
        // Explicit configuration takes precedence
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(StorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(StorageProvider::isAvailable)
                .max(Comparator.comparingInt(StorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available storage providers"));
    }
}
