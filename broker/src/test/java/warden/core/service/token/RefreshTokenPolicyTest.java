package warden.core.service.token;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RefreshTokenPolicy")
class RefreshTokenPolicyTest {

    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    @DisplayName("reuse should be allowed up to and including the interval")
    void reuseWindow() {
        var policy = new RefreshTokenPolicy(true, Duration.ofSeconds(3), Optional.empty(), Optional.empty());

        assertTrue(policy.allowedToReuse(T0, T0.plusSeconds(3)));
        assertFalse(policy.allowedToReuse(T0, T0.plusSeconds(3).plusMillis(1)));
    }

    @Test
    @DisplayName("a zero interval should disable reuse")
    void zeroInterval() {
        var policy = new RefreshTokenPolicy(true, Duration.ZERO, Optional.empty(), Optional.empty());

        assertFalse(policy.allowedToReuse(T0, T0));
    }

    @Test
    @DisplayName("absolute lifetime should be measured from creation")
    void absoluteLifetime() {
        var policy = new RefreshTokenPolicy(
                true, Duration.ZERO, Optional.of(Duration.ofDays(90)), Optional.empty());

        assertFalse(policy.completelyExpired(T0, T0.plus(Duration.ofDays(90))));
        assertTrue(policy.completelyExpired(T0, T0.plus(Duration.ofDays(91))));
        assertFalse(policy.expiredBecauseUnused(T0, T0.plus(Duration.ofDays(365))));
    }

    @Test
    @DisplayName("idle lifetime should be measured from last use")
    void idleLifetime() {
        var policy = new RefreshTokenPolicy(
                true, Duration.ZERO, Optional.empty(), Optional.of(Duration.ofDays(30)));

        assertFalse(policy.expiredBecauseUnused(T0, T0.plus(Duration.ofDays(30))));
        assertTrue(policy.expiredBecauseUnused(T0, T0.plus(Duration.ofDays(31))));
        assertFalse(policy.completelyExpired(T0, T0.plus(Duration.ofDays(365))));
    }

    @Test
    @DisplayName("a negative reuse interval should be rejected")
    void negativeInterval() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new RefreshTokenPolicy(true, Duration.ofSeconds(-1), Optional.empty(), Optional.empty()));
    }
}
