package warden.adapter.out.storage.sql;

import java.sql.SQLException;
import java.util.Optional;

import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.supplier.AgroalDataSourceConfigurationSupplier;
import io.agroal.api.security.NamePrincipal;
import io.agroal.api.security.SimplePassword;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.OfflineSessionKey;
import warden.core.model.storage.StorageHealth;
import warden.core.port.out.Storage;
import warden.core.port.out.StorageHealthIndicator;
import warden.spi.StorageAdapterConfig;
import warden.spi.StorageProvider;
import warden.spi.StorageProviderException;

/**
 * Relational storage provider backed by an Agroal connection pool.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>warden.storage.sql.jdbc-url - JDBC URL; the provider is unavailable without it</li>
 *   <li>warden.storage.sql.username - Database user (optional)</li>
 *   <li>warden.storage.sql.password - Database password (optional)</li>
 *   <li>warden.storage.sql.max-pool-size - Maximum pooled connections (default: 10)</li>
 *   <li>warden.storage.sql.run-migrations - Apply schema migrations at startup (default: true)</li>
 *   <li>warden.storage.sql.max-serialization-retries - Retries for conflicting updates (default: 3)</li>
 * </ul>
 */
public class SqlStorageProvider implements StorageProvider {

    private static final Logger LOG = Logger.getLogger(SqlStorageProvider.class);
    private static final String JDBC_URL = "sql.jdbc-url";
    private static final int HEALTH_CHECK_TIMEOUT_SECONDS = 2;

    private AgroalDataSource dataSource;

    @Override
    public String name() {
        return "sql";
    }

    @Override
    public String description() {
        return "Relational database storage (PostgreSQL)";
    }

    @Override
    public int priority() {
        return 10; // Higher than memory
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("io.agroal.api.AgroalDataSource");
        } catch (ClassNotFoundException e) {
            return false;
        }
        return ConfigProvider.getConfig().getOptionalValue(StorageAdapterConfig.PREFIX + JDBC_URL, String.class).isPresent();
    }

    @Override
    public Storage createStorage(StorageAdapterConfig config) {
        final var jdbcUrl = config.getRequired(JDBC_URL);
        final var maxPoolSize = config.getInt("sql.max-pool-size").orElse(10);
        final var username = config.get("sql.username");
        final var password = config.get("sql.password");

        try {
            this.dataSource = AgroalDataSource.from(new AgroalDataSourceConfigurationSupplier()
                    .connectionPoolConfiguration(pool -> pool.maxSize(maxPoolSize)
                            .connectionFactoryConfiguration(factory -> {
                                factory.jdbcUrl(jdbcUrl);
                                username.ifPresent(u -> factory.principal(new NamePrincipal(u)));
                                password.ifPresent(p -> factory.credential(new SimplePassword(p)));
                                return factory;
                            })));
        } catch (SQLException e) {
            throw new StorageProviderException("Failed to create connection pool for " + jdbcUrl, e);
        }

        if (config.getBoolean("sql.run-migrations").orElse(true)) {
            LOG.info("Running SQL migrations...");
            new SqlSchemaMigrator(dataSource).migrate();
        }

        final var algorithm = config.offlineSessionKeyAlgorithm();
        final var retries = config.getInt("sql.max-serialization-retries").orElse(3);
        LOG.infof("SQL storage ready (pool size %d)", maxPoolSize);
        return new SqlStorage(dataSource, new OfflineSessionKey(algorithm), retries);
    }

    @Override
    public Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.of(() -> {
            if (dataSource == null) {
                return Uni.createFrom().item(StorageHealth.down("sql", "Connection pool not initialized"));
            }

            return Uni.createFrom()
                    .item(() -> {
                        final long start = System.currentTimeMillis();
                        try (var conn = dataSource.getConnection()) {
                            if (!conn.isValid(HEALTH_CHECK_TIMEOUT_SECONDS)) {
                                return StorageHealth.down("sql", "Connection is not valid");
                            }
                            return StorageHealth.up("sql", System.currentTimeMillis() - start);
                        } catch (SQLException e) {
                            return StorageHealth.down("sql", e.getMessage());
                        }
                    })
                    .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
        });
    }
}
