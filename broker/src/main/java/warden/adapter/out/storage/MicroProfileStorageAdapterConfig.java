package warden.adapter.out.storage;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import warden.spi.StorageAdapterConfig;

/**
 * Resolves storage provider settings under {@code warden.storage.} from MicroProfile Config.
 */
@ApplicationScoped
public class MicroProfileStorageAdapterConfig implements StorageAdapterConfig {

    private final Config config;

    @Inject
    public MicroProfileStorageAdapterConfig(Config config) {
        this.config = config;
    }

    @Override
    public String getRequired(String key) {
        return get(key).orElseThrow(() -> new IllegalStateException("Missing storage setting " + PREFIX + key));
    }

    @Override
    public Optional<String> get(String key) {
        return config.getOptionalValue(PREFIX + key, String.class).filter(value -> !value.isBlank());
    }

    @Override
    public String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    @Override
    public Optional<Integer> getInt(String key) {
        return config.getOptionalValue(PREFIX + key, Integer.class);
    }

    @Override
    public Optional<Boolean> getBoolean(String key) {
        return config.getOptionalValue(PREFIX + key, Boolean.class);
    }
}
