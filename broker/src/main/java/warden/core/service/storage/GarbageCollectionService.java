package warden.core.service.storage;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.GarbageCollectionConfig;
import warden.core.model.storage.GcResult;
import warden.core.port.out.Metrics;
import warden.core.port.out.Storage;

/**
 * Periodically removes expired auth requests, auth codes, device requests and device tokens.
 *
 * <p>Refresh tokens have no expiry and are left alone.
 */
@ApplicationScoped
public class GarbageCollectionService {

    private static final Logger LOG = Logger.getLogger(GarbageCollectionService.class);

    private final Storage storage;
    private final Metrics metrics;
    private final GarbageCollectionConfig config;
    private final Clock clock;

    @Inject
    public GarbageCollectionService(Storage storage, Metrics metrics, GarbageCollectionConfig config) {
        this(storage, metrics, config, Clock.systemUTC());
    }

    GarbageCollectionService(Storage storage, Metrics metrics, GarbageCollectionConfig config, Clock clock) {
        this.storage = storage;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    @Scheduled(
            every = "${warden.gc.interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledCollect() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        // Failures are logged and counted by collect(); the next sweep retries
        return collect().replaceWithVoid().onFailure().recoverWithNull();
    }

    /**
     * Run one sweep with the current time as the cutoff.
     *
     * @return counts of removed rows per entity type
     */
    public Uni<GcResult> collect() {
        final var now = clock.instant();
        LOG.debugv("Collecting credentials that expired before {0}", now);

        return storage.garbageCollect(now)
                .invoke(result -> {
                    metrics.recordGarbageCollection(result);
                    if (!result.isEmpty()) {
                        LOG.infof(
                                "Garbage collection removed %d auth requests, %d auth codes, "
                                        + "%d device requests, %d device tokens",
                                result.authRequests(),
                                result.authCodes(),
                                result.deviceRequests(),
                                result.deviceTokens());
                    }
                })
                .onFailure()
                .invoke(e -> {
                    metrics.recordGarbageCollectionFailure();
                    LOG.error("Garbage collection failed", e);
                });
    }
}
