package warden.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.storage.GcResult;

@DisplayName("BrokerMetrics")
class BrokerMetricsTest {

    private SimpleMeterRegistry registry;
    private BrokerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new BrokerMetrics(registry);
    }

    @Nested
    @DisplayName("Garbage collection")
    class GarbageCollection {

        @Test
        @DisplayName("should count deleted rows per entity type")
        void deletedPerType() {
            metrics.recordGarbageCollection(new GcResult(2, 1, 0, 3));
            metrics.recordGarbageCollection(new GcResult(1, 0, 0, 0));

            assertEquals(3.0, deleted("auth_request"));
            assertEquals(1.0, deleted("auth_code"));
            assertEquals(0.0, deleted("device_request"));
            assertEquals(3.0, deleted("device_token"));
        }

        @Test
        @DisplayName("should count failed sweeps")
        void failures() {
            metrics.recordGarbageCollectionFailure();
            metrics.recordGarbageCollectionFailure();

            assertEquals(2.0, registry.get("warden.gc.failures").counter().count());
        }

        private double deleted(String type) {
            return registry.get("warden.gc.deleted").tag("type", type).counter().count();
        }
    }

    @Test
    @DisplayName("should count key rotations")
    void keyRotations() {
        metrics.recordKeyRotation();

        assertEquals(1.0, registry.get("warden.keys.rotations").counter().count());
    }

    @Test
    @DisplayName("should count refresh outcomes by tag")
    void refreshOutcomes() {
        metrics.recordRefresh("rotated");
        metrics.recordRefresh("rotated");
        metrics.recordRefresh("rejected");
        metrics.recordRefresh(null);

        assertEquals(2.0, outcome("rotated"));
        assertEquals(1.0, outcome("rejected"));
        assertEquals(1.0, outcome("unknown"));
        assertNull(registry.find("warden.refresh.outcomes").tag("outcome", "reused").counter());
    }

    private double outcome(String outcome) {
        return registry.get("warden.refresh.outcomes").tag("outcome", outcome).counter().count();
    }
}
