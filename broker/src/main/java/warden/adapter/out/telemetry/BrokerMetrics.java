package warden.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.model.storage.GcResult;
import warden.core.port.out.Metrics;

/**
 * Micrometer implementation of the broker metrics port.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code warden.gc.deleted} - Expired rows removed, tagged by entity type</li>
 *   <li>{@code warden.gc.failures} - Failed garbage collection sweeps</li>
 *   <li>{@code warden.keys.rotations} - Signing key rotations performed by this instance</li>
 *   <li>{@code warden.refresh.outcomes} - Refresh token redemptions by outcome</li>
 * </ul>
 */
@ApplicationScoped
public class BrokerMetrics implements Metrics {

    private final MeterRegistry registry;

    @Inject
    public BrokerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordGarbageCollection(GcResult result) {
        deleted("auth_request", result.authRequests());
        deleted("auth_code", result.authCodes());
        deleted("device_request", result.deviceRequests());
        deleted("device_token", result.deviceTokens());
    }

    @Override
    public void recordGarbageCollectionFailure() {
        Counter.builder("warden.gc.failures")
                .description("Failed garbage collection sweeps")
                .register(registry)
                .increment();
    }

    @Override
    public void recordKeyRotation() {
        Counter.builder("warden.keys.rotations")
                .description("Signing key rotations")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRefresh(String outcome) {
        Counter.builder("warden.refresh.outcomes")
                .description("Refresh token redemptions")
                .tag("outcome", outcome != null ? outcome : "unknown")
                .register(registry)
                .increment();
    }

    private void deleted(String type, long count) {
        Counter.builder("warden.gc.deleted")
                .description("Expired rows removed by garbage collection")
                .tag("type", type)
                .register(registry)
                .increment(count);
    }
}
