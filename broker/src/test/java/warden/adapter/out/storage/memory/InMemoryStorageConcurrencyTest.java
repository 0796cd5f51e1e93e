package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.exception.StorageAlreadyExistsException;
import warden.core.model.storage.Client;
import warden.core.model.storage.Keys;

@DisplayName("InMemoryStorage concurrency")
class InMemoryStorageConcurrencyTest {

    private static final int THREADS = 8;
    private static final int ITERATIONS = 250;

    private InMemoryStorage storage;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorage();
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("concurrent updates of the same row should not lose writes")
    void concurrentUpdatesSerialize() throws Exception {
        storage.createClient(new Client("app", "0", List.of(), List.of(), false, "App", null))
                .await()
                .atMost(Duration.ofSeconds(5));
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<?>>();

        for (int t = 0; t < THREADS; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < ITERATIONS; i++) {
                    storage.updateClient("app", c -> new Client(
                                    c.id(),
                                    String.valueOf(Integer.parseInt(c.secret()) + 1),
                                    c.redirectUris(),
                                    c.trustedPeers(),
                                    c.isPublic(),
                                    c.name(),
                                    c.logoUrl()))
                            .await()
                            .atMost(Duration.ofSeconds(5));
                }
                return null;
            }));
        }
        start.countDown();
        for (var future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        var client = storage.getClient("app").await().atMost(Duration.ofSeconds(5));
        assertEquals(String.valueOf(THREADS * ITERATIONS), client.secret());
    }

    @Test
    @DisplayName("concurrent creates of the same id should let exactly one win")
    void concurrentCreatesCollide() throws Exception {
        var start = new CountDownLatch(1);
        var created = new AtomicInteger();
        var collisions = new AtomicInteger();
        var futures = new ArrayList<Future<?>>();

        for (int t = 0; t < THREADS; t++) {
            final var secret = String.valueOf(t);
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    storage.createClient(new Client("app", secret, List.of(), List.of(), false, "App", null))
                            .await()
                            .atMost(Duration.ofSeconds(5));
                    created.incrementAndGet();
                } catch (StorageAlreadyExistsException e) {
                    collisions.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (var future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        assertEquals(1, created.get());
        assertEquals(THREADS - 1, collisions.get());
    }

    @Test
    @DisplayName("concurrent key updates should each observe the previous write")
    void concurrentKeyUpdates() throws Exception {
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<?>>();

        for (int t = 0; t < THREADS; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < ITERATIONS; i++) {
                    storage.updateKeys(k -> new Keys(
                                    k.signingKey(), k.signingKeyPub(), k.verificationKeys(), k.nextRotation()
                                            .plusSeconds(1)))
                            .await()
                            .atMost(Duration.ofSeconds(5));
                }
                return null;
            }));
        }
        start.countDown();
        for (var future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        var keys = storage.getKeys().await().atMost(Duration.ofSeconds(5));
        assertEquals(Instant.EPOCH.plusSeconds(THREADS * ITERATIONS), keys.nextRotation());
        assertTrue(keys.verificationKeys().isEmpty());
    }
}
