package warden.core.model.storage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Refresh tokens a user holds through one connector, keyed by client id.
 *
 * <p>Identified by the composite ({@code userId}, {@code connectorId}); storage backends
 * derive a single synthetic key from it.
 */
public record OfflineSessions(
        String userId, String connectorId, Map<String, RefreshTokenRef> refresh, byte[] connectorData) {

    public OfflineSessions {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(connectorId, "connectorId is required");
        refresh = refresh != null ? Map.copyOf(refresh) : Map.of();
    }

    public OfflineSessions withRefresh(RefreshTokenRef ref) {
        var updated = new LinkedHashMap<>(refresh);
        updated.put(ref.clientId(), ref);
        return new OfflineSessions(userId, connectorId, updated, connectorData);
    }

    public OfflineSessions withoutClient(String clientId) {
        var updated = new LinkedHashMap<>(refresh);
        updated.remove(clientId);
        return new OfflineSessions(userId, connectorId, updated, connectorData);
    }

    public OfflineSessions withConnectorData(byte[] data) {
        return new OfflineSessions(userId, connectorId, refresh, data);
    }
}
