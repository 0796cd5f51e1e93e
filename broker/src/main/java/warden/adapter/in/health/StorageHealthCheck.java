package warden.adapter.in.health;

import java.time.Duration;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import warden.core.model.storage.StorageHealth;
import warden.core.port.out.StorageHealthIndicator;

/**
 * Readiness check for the selected storage backend.
 *
 * <p>DOWN when any indicator reports unhealthy or does not answer within five seconds.
 */
@Readiness
@ApplicationScoped
public class StorageHealthCheck implements AsyncHealthCheck {

    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final List<StorageHealthIndicator> indicators;

    @Inject
    public StorageHealthCheck(List<StorageHealthIndicator> indicators) {
        this.indicators = indicators;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        return Multi.createFrom()
                .iterable(indicators)
                .onItem()
                .transformToUniAndConcatenate(indicator -> indicator.checkWithin(CHECK_TIMEOUT))
                .collect()
                .asList()
                .map(StorageHealthCheck::toResponse);
    }

    static HealthCheckResponse toResponse(List<StorageHealth> results) {
        final var builder = HealthCheckResponse.named("storage");
        var up = true;
        for (var health : results) {
            builder.withData(health.backend() + ".status", health.up() ? "UP" : "DOWN");
            if (health.detail() != null) {
                builder.withData(health.backend() + ".message", health.detail());
            }
            if (health.hasLatency()) {
                builder.withData(health.backend() + ".latencyMs", health.latencyMs());
            }
            up &= health.up();
        }
        return builder.status(up).build();
    }
}
