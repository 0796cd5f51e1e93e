package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for signing key rotation.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.key-rotation.enabled=true
 * warden.key-rotation.check-interval=30s
 * warden.key-rotation.rotation-frequency=PT6H
 * warden.key-rotation.id-tokens-valid-for=PT24H
 * warden.key-rotation.key-size=2048
 * }</pre>
 */
@ConfigMapping(prefix = "warden.key-rotation")
public interface KeyRotationConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * How often to check whether the keys are due. Rotation itself happens at most once
     * per {@link #rotationFrequency()} across all instances.
     */
    @WithName("check-interval")
    @WithDefault("30s")
    Duration checkInterval();

    /**
     * Time between rotations.
     */
    @WithName("rotation-frequency")
    @WithDefault("PT6H")
    Duration rotationFrequency();

    /**
     * How long a demoted signing key stays available for verification.
     *
     * <p>Must cover the lifetime of every ID token it signed.
     */
    @WithName("id-tokens-valid-for")
    @WithDefault("PT24H")
    Duration idTokensValidFor();

    /**
     * RSA key size in bits.
     */
    @WithName("key-size")
    @WithDefault("2048")
    int keySize();
}
