package warden.core.model.storage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A short-lived authorization code, read once and deleted at token exchange.
 */
public record AuthCode(
        String id,
        String clientId,
        String redirectUri,
        String nonce,
        List<String> scopes,
        String connectorId,
        byte[] connectorData,
        Claims claims,
        Instant expiry,
        Pkce pkce) {

    public AuthCode {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(expiry, "expiry is required");
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
        pkce = pkce != null ? pkce : Pkce.NONE;
    }
}
