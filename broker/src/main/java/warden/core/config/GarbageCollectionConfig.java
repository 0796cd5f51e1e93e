package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the expired-credential sweep.
 *
 * <pre>{@code
 * warden.gc.enabled=true
 * warden.gc.interval=5m
 * }</pre>
 */
@ConfigMapping(prefix = "warden.gc")
public interface GarbageCollectionConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Time between sweeps. Read by the scheduler expression as well.
     */
    @WithDefault("5m")
    Duration interval();
}
