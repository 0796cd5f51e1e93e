package warden.core.service.token;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.config.RefreshTokenConfig;
import warden.core.model.storage.RefreshToken;

/**
 * Lifetime and rotation rules for refresh tokens.
 */
@ApplicationScoped
public class RefreshTokenPolicy {

    private final boolean rotate;
    private final Duration reuseInterval;
    private final Optional<Duration> absoluteLifetime;
    private final Optional<Duration> validIfNotUsedFor;

    @Inject
    public RefreshTokenPolicy(RefreshTokenConfig config) {
        this(config.rotate(), config.reuseInterval(), config.absoluteLifetime(), config.validIfNotUsedFor());
    }

    public RefreshTokenPolicy(
            boolean rotate,
            Duration reuseInterval,
            Optional<Duration> absoluteLifetime,
            Optional<Duration> validIfNotUsedFor) {
        if (reuseInterval.isNegative()) {
            throw new IllegalArgumentException("reuse interval must not be negative: " + reuseInterval);
        }
        this.rotate = rotate;
        this.reuseInterval = reuseInterval;
        this.absoluteLifetime = absoluteLifetime;
        this.validIfNotUsedFor = validIfNotUsedFor;
    }

    public boolean rotationEnabled() {
        return rotate;
    }

    /**
     * Whether the previous bearer value may still be presented, given when the token was last rotated.
     */
    public boolean allowedToReuse(Instant lastUsed, Instant now) {
        if (reuseInterval.isZero()) {
            return false;
        }
        return !now.isAfter(lastUsed.plus(reuseInterval));
    }

    public boolean completelyExpired(Instant createdAt, Instant now) {
        return absoluteLifetime
                .map(lifetime -> now.isAfter(createdAt.plus(lifetime)))
                .orElse(false);
    }

    public boolean expiredBecauseUnused(Instant lastUsed, Instant now) {
        return validIfNotUsedFor.map(idle -> now.isAfter(lastUsed.plus(idle))).orElse(false);
    }

    public boolean expired(RefreshToken token, Instant now) {
        return completelyExpired(token.createdAt(), now) || expiredBecauseUnused(token.lastUsed(), now);
    }
}
