package warden.core.model.storage;

/**
 * Result of probing a storage backend.
 *
 * @param backend   provider name, used as the key prefix in the readiness response
 * @param up        whether the backend answered correctly
 * @param detail    {@code OK} or the failure reason
 * @param latencyMs round-trip time of the probe, {@code -1} when it failed
 */
public record StorageHealth(String backend, boolean up, String detail, long latencyMs) {

    public static StorageHealth up(String backend, long latencyMs) {
        return new StorageHealth(backend, true, "OK", latencyMs);
    }

    public static StorageHealth down(String backend, String detail) {
        return new StorageHealth(backend, false, detail, -1);
    }

    public boolean hasLatency() {
        return latencyMs >= 0;
    }
}
