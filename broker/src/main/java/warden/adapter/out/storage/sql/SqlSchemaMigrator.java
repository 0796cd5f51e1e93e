package warden.adapter.out.storage.sql;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.sql.DataSource;

import org.jboss.logging.Logger;

import warden.spi.StorageProviderException;

/**
 * Applies versioned SQL migrations from the classpath.
 *
 * <p>Migration files live under db/sql/ and follow the naming convention
 * V{version}__{description}.sql. Applied versions are tracked in schema_migrations so each
 * migration runs once. Every migration runs in its own transaction.
 */
public class SqlSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SqlSchemaMigrator.class);
    private static final String MIGRATIONS_PATH = "db/sql/";
    private static final Pattern MIGRATION_PATTERN = Pattern.compile("V(\\d+)__.*\\.sql");

    // Classpath directories cannot be listed inside a jar; register new migrations here.
    private static final List<String> MIGRATIONS = List.of("V1__create_tables.sql");

    private final DataSource dataSource;

    public SqlSchemaMigrator(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run all pending migrations.
     *
     * @return the number of migrations applied
     */
    public int migrate() {
        try (Connection conn = dataSource.getConnection()) {
            ensureMigrationTableExists(conn);
            final var applied = appliedVersions(conn);

            int count = 0;
            for (var migration : discoverMigrations()) {
                if (!applied.contains(migration.version())) {
                    apply(conn, migration);
                    count++;
                }
            }

            if (count > 0) {
                LOG.infof("Applied %d migration(s)", count);
            } else {
                LOG.debug("No pending migrations");
            }
            return count;
        } catch (SQLException e) {
            LOG.errorf(e, "Schema migration failed");
            throw new StorageProviderException("Schema migration failed", e);
        }
    }

    private void ensureMigrationTableExists(Connection conn) throws SQLException {
        try (var stmt = conn.createStatement()) {
            stmt.execute(
                    """
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version integer NOT NULL PRIMARY KEY,
                        script_name varchar NOT NULL,
                        applied_at timestamp with time zone NOT NULL
                    )
                    """);
        }
    }

    private Set<Integer> appliedVersions(Connection conn) throws SQLException {
        final var versions = new HashSet<Integer>();
        try (var stmt = conn.createStatement();
                var rs = stmt.executeQuery("SELECT version FROM schema_migrations")) {
            while (rs.next()) {
                versions.add(rs.getInt(1));
            }
        }
        return versions;
    }

    private List<Migration> discoverMigrations() {
        final var migrations = new ArrayList<Migration>();
        for (String filename : MIGRATIONS) {
            final var matcher = MIGRATION_PATTERN.matcher(filename);
            if (!matcher.matches()) {
                throw new StorageProviderException("Invalid migration file name: " + filename);
            }
            migrations.add(new Migration(Integer.parseInt(matcher.group(1)), filename, read(filename)));
        }
        return migrations;
    }

    private String read(String filename) {
        final var path = MIGRATIONS_PATH + filename;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new StorageProviderException("Migration file not found: " + path);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageProviderException("Failed to read migration " + path, e);
        }
    }

    private void apply(Connection conn, Migration migration) throws SQLException {
        LOG.infof("Applying migration V%d: %s", migration.version(), migration.filename());

        conn.setAutoCommit(false);
        try {
            try (var stmt = conn.createStatement()) {
                for (String statement : statements(migration.content())) {
                    stmt.execute(statement);
                }
            }
            try (var insert = conn.prepareStatement(
                    "INSERT INTO schema_migrations (version, script_name, applied_at) VALUES (?, ?, ?)")) {
                insert.setInt(1, migration.version());
                insert.setString(2, migration.filename());
                insert.setObject(3, OffsetDateTime.now(ZoneOffset.UTC));
                insert.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            LOG.errorf("Failed to apply %s: %s", migration.filename(), e.getMessage());
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    static List<String> statements(String script) {
        final var withoutComments = script.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));
        final var statements = new ArrayList<String>();
        for (String statement : withoutComments.split(";")) {
            final var trimmed = statement.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        return statements;
    }

    private record Migration(int version, String filename, String content) {}
}
