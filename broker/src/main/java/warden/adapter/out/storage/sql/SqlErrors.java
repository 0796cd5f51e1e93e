package warden.adapter.out.storage.sql;

import java.sql.SQLException;
import java.util.Set;

import warden.core.exception.StorageAlreadyExistsException;
import warden.core.exception.StorageException;

/**
 * Maps JDBC failures onto the storage error contract.
 *
 * <p>Recognizes PostgreSQL and H2 through SQLState, MySQL through its vendor code.
 */
final class SqlErrors {

    private static final String UNIQUE_VIOLATION = "23505";
    private static final int MYSQL_DUPLICATE_ENTRY = 1062;

    private static final Set<String> SERIALIZATION_FAILURES = Set.of(
            "40001", // serialization_failure
            "40P01", // deadlock_detected (PostgreSQL)
            "90131" // concurrent update (H2)
            );

    private SqlErrors() {}

    static boolean isUniqueViolation(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            if (UNIQUE_VIOLATION.equals(current.getSQLState()) || current.getErrorCode() == MYSQL_DUPLICATE_ENTRY) {
                return true;
            }
        }
        return false;
    }

    static boolean isSerializationFailure(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            if (current.getSQLState() != null && SERIALIZATION_FAILURES.contains(current.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Translate a failure of an operation on one row.
     */
    static StorageException translate(String entity, String id, SQLException e) {
        if (isUniqueViolation(e)) {
            return new StorageAlreadyExistsException("%s %s already exists".formatted(entity, id), e);
        }
        return new StorageException("Failed to access %s %s".formatted(entity, id), e);
    }
}
