package warden.core.model.storage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A long-lived credential tying a client to a user session.
 *
 * <p>{@code token} changes on every use; {@code obsoleteToken} keeps the previous value so
 * a replay inside the reuse interval can still be honoured. Refresh tokens carry no expiry
 * and are never removed by the garbage collector.
 */
public record RefreshToken(
        String id,
        String token,
        String obsoleteToken,
        Instant createdAt,
        Instant lastUsed,
        String clientId,
        String connectorId,
        byte[] connectorData,
        Claims claims,
        List<String> scopes,
        String nonce) {

    public RefreshToken {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(token, "token is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(lastUsed, "lastUsed is required");
        obsoleteToken = obsoleteToken != null ? obsoleteToken : "";
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
    }

    /**
     * Replace the bearer value, keeping the current one as the obsolete token.
     */
    public RefreshToken rotate(String newToken, Instant now) {
        return new RefreshToken(
                id, newToken, token, createdAt, now, clientId, connectorId, connectorData, claims, scopes, nonce);
    }

    public RefreshToken touch(Instant now) {
        return new RefreshToken(
                id, token, obsoleteToken, createdAt, now, clientId, connectorId, connectorData, claims, scopes, nonce);
    }

    public RefreshToken withIdentity(Claims newClaims, byte[] newConnectorData) {
        return new RefreshToken(
                id,
                token,
                obsoleteToken,
                createdAt,
                lastUsed,
                clientId,
                connectorId,
                newConnectorData,
                newClaims,
                scopes,
                nonce);
    }

    public RefreshTokenRef toRef() {
        return new RefreshTokenRef(id, clientId, createdAt, lastUsed);
    }
}
