package warden.core.model.identity;

import java.util.List;
import java.util.Objects;

/**
 * Canonical, provider-agnostic record of an authenticated end user.
 *
 * <p>Produced fresh by a connector on every successful callback or refresh and owned
 * by the caller afterwards. {@code connectorData} is opaque: only the connector that
 * produced it may interpret the bytes.
 *
 * @param userId            provider-scoped identifier, stable across logins
 * @param username          display name, never empty (falls back to the email address)
 * @param preferredUsername provider login handle, may be null
 * @param email             email address reported by the provider
 * @param emailVerified     whether the provider vouches for the email address
 * @param groups            provider-scoped group identifiers, optionally suffixed with {@code :role}
 * @param connectorData     connector-specific state needed to refresh, may be null
 */
public record Identity(
        String userId,
        String username,
        String preferredUsername,
        String email,
        boolean emailVerified,
        List<String> groups,
        byte[] connectorData) {

    public Identity {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(username, "username is required");
        if (username.isEmpty()) {
            throw new IllegalArgumentException("username must not be empty");
        }
        groups = groups != null ? List.copyOf(groups) : List.of();
        connectorData = connectorData != null ? connectorData.clone() : null;
    }

    @Override
    public byte[] connectorData() {
        return connectorData != null ? connectorData.clone() : null;
    }

    /**
     * Pick the display name, falling back to the email address when the provider has none.
     */
    public static String displayName(String name, String email) {
        return name == null || name.isEmpty() ? email : name;
    }

    public Identity withGroups(List<String> newGroups) {
        return new Identity(userId, username, preferredUsername, email, emailVerified, newGroups, connectorData);
    }

    public Identity withConnectorData(byte[] data) {
        return new Identity(userId, username, preferredUsername, email, emailVerified, groups, data);
    }
}
