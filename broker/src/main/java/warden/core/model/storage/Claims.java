package warden.core.model.storage;

import java.util.List;

import warden.core.model.identity.Identity;

/**
 * Identity fields embedded in auth requests, auth codes and refresh tokens.
 */
public record Claims(
        String userId,
        String username,
        String preferredUsername,
        String email,
        boolean emailVerified,
        List<String> groups) {

    public Claims {
        groups = groups != null ? List.copyOf(groups) : List.of();
    }

    public static Claims from(Identity identity) {
        return new Claims(
                identity.userId(),
                identity.username(),
                identity.preferredUsername(),
                identity.email(),
                identity.emailVerified(),
                identity.groups());
    }

    /**
     * Rebuild the identity these claims were taken from, attaching the given connector data.
     */
    public Identity toIdentity(byte[] connectorData) {
        return new Identity(
                userId,
                Identity.displayName(username, email),
                preferredUsername,
                email,
                emailVerified,
                groups,
                connectorData);
    }
}
