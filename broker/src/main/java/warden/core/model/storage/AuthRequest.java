package warden.core.model.storage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An authorization request that has not yet been turned into an auth code.
 *
 * <p>Created when a client starts a login, updated once the user has authenticated
 * upstream ({@code loggedIn}, {@code claims}, {@code connectorData}) and removed by
 * the garbage collector once {@code expiry} has passed.
 */
public record AuthRequest(
        String id,
        String clientId,
        List<String> responseTypes,
        List<String> scopes,
        String redirectUri,
        String nonce,
        String state,
        boolean forceApprovalPrompt,
        Instant expiry,
        boolean loggedIn,
        Claims claims,
        String connectorId,
        byte[] connectorData,
        Pkce pkce,
        byte[] hmacKey) {

    public AuthRequest {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(expiry, "expiry is required");
        responseTypes = responseTypes != null ? List.copyOf(responseTypes) : List.of();
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
        pkce = pkce != null ? pkce : Pkce.NONE;
    }

    /**
     * Mark the request as authenticated by the given connector.
     */
    public AuthRequest loggedIn(Claims newClaims, String newConnectorId, byte[] newConnectorData) {
        return new AuthRequest(
                id,
                clientId,
                responseTypes,
                scopes,
                redirectUri,
                nonce,
                state,
                forceApprovalPrompt,
                expiry,
                true,
                newClaims,
                newConnectorId,
                newConnectorData,
                pkce,
                hmacKey);
    }
}
