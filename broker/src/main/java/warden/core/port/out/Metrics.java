package warden.core.port.out;

import warden.core.model.storage.GcResult;

/**
 * Port interface for recording broker metrics.
 */
public interface Metrics {

    /**
     * Record a completed garbage collection sweep.
     */
    void recordGarbageCollection(GcResult result);

    void recordGarbageCollectionFailure();

    void recordKeyRotation();

    /**
     * Record the outcome of a refresh token redemption.
     *
     * @param outcome one of {@code rotated}, {@code reused}, {@code rejected}
     */
    void recordRefresh(String outcome);
}
