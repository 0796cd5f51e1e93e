package warden.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Refresh token lifetime and rotation policy.
 *
 * <pre>{@code
 * warden.refresh-tokens.rotate=true
 * warden.refresh-tokens.reuse-interval=PT3S
 * warden.refresh-tokens.absolute-lifetime=P90D
 * warden.refresh-tokens.valid-if-not-used-for=P30D
 * }</pre>
 */
@ConfigMapping(prefix = "warden.refresh-tokens")
public interface RefreshTokenConfig {

    /**
     * Issue a new bearer value on every redemption.
     */
    @WithDefault("true")
    boolean rotate();

    /**
     * Window after a rotation during which the previous value is still honoured.
     * Zero disables reuse.
     */
    @WithName("reuse-interval")
    @WithDefault("PT3S")
    Duration reuseInterval();

    /**
     * Maximum age measured from creation. Absent means unlimited.
     */
    @WithName("absolute-lifetime")
    Optional<Duration> absoluteLifetime();

    /**
     * Maximum idle time measured from the last use. Absent means unlimited.
     */
    @WithName("valid-if-not-used-for")
    Optional<Duration> validIfNotUsedFor();
}
