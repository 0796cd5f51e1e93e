package warden.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import warden.core.model.storage.StorageHealth;

/**
 * Probe for the selected storage backend, exposed through the readiness check.
 */
@FunctionalInterface
public interface StorageHealthIndicator {

    Uni<StorageHealth> check();

    /**
     * Probe with a deadline. Never fails: timeouts and errors become a down result.
     */
    default Uni<StorageHealth> checkWithin(Duration timeout) {
        return check().ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> StorageHealth.down("storage", "no answer within " + timeout))
                .onFailure()
                .recoverWithItem(e -> StorageHealth.down("storage", e.getMessage()));
    }
}
