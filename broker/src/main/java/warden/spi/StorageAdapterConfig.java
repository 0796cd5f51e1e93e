package warden.spi;

import java.util.Optional;

import warden.core.util.SecureHash;

/**
 * Configuration access for storage providers.
 *
 * <p>Keys are relative to {@value #PREFIX}, so the SQL provider reads {@code sql.jdbc-url}
 * from {@code warden.storage.sql.jdbc-url}. Lets providers read their settings without coupling
 * to a configuration framework.
 */
public interface StorageAdapterConfig {

    String PREFIX = "warden.storage.";

    /**
     * @throws IllegalStateException if not configured
     */
    String getRequired(String key);

    Optional<String> get(String key);

    String getOrDefault(String key, String defaultValue);

    Optional<Integer> getInt(String key);

    Optional<Boolean> getBoolean(String key);

    /**
     * Digest used to derive offline session keys; every backend must agree on it.
     */
    default String offlineSessionKeyAlgorithm() {
        return getOrDefault("offline-session-key-algorithm", SecureHash.DEFAULT_ALGORITHM);
    }
}
