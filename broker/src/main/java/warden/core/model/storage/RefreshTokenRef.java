package warden.core.model.storage;

import java.time.Instant;

/**
 * Lightweight pointer to a refresh token, kept per client in an offline session.
 */
public record RefreshTokenRef(String id, String clientId, Instant createdAt, Instant lastUsed) {}
