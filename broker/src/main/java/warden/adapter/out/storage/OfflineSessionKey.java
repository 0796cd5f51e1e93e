package warden.adapter.out.storage;

import warden.core.util.SecureHash;

/**
 * Derives the single-column key offline sessions are stored under.
 *
 * <p>Offline sessions are identified by (userId, connectorId); backends that only support
 * single-column primary keys store them under the hex digest of the concatenation.
 */
public final class OfflineSessionKey {

    private final String algorithm;

    public OfflineSessionKey(String algorithm) {
        SecureHash.requireAlgorithm(algorithm);
        this.algorithm = algorithm;
    }

    public static OfflineSessionKey sha256() {
        return new OfflineSessionKey(SecureHash.DEFAULT_ALGORITHM);
    }

    public String derive(String userId, String connectorId) {
        return SecureHash.hex(algorithm, userId + connectorId);
    }

    public String algorithm() {
        return algorithm;
    }
}
