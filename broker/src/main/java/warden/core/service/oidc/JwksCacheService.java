package warden.core.service.oidc;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import warden.core.exception.BrokerException;
import warden.core.exception.UpstreamMalformedResponseException;
import warden.core.exception.UpstreamUnreachableException;
import warden.core.port.out.JwksCache;

/**
 * Caches the JSON Web Key Sets upstream providers sign their ID tokens with.
 *
 * <p>Features:
 * <ul>
 *   <li>Bounded Caffeine cache with a configurable TTL</li>
 *   <li>One forced refresh when a token names an unknown key (upstream rotation)</li>
 *   <li>Request coalescing so concurrent misses trigger a single fetch</li>
 * </ul>
 */
@ApplicationScoped
public class JwksCacheService implements JwksCache {

    private static final Logger LOG = Logger.getLogger(JwksCacheService.class);
    private static final int MAX_CACHE_ENTRIES = 100;

    private final WebClient webClient;
    private final Cache<URI, JsonWebKeySet> cache;
    private final Map<URI, Uni<JsonWebKeySet>> inFlightFetches = new ConcurrentHashMap<>();
    private final Duration fetchTimeout;

    @Inject
    public JwksCacheService(
            Vertx vertx,
            @ConfigProperty(name = "warden.jwks.cache-ttl", defaultValue = "PT1H") Duration cacheTtl,
            @ConfigProperty(name = "warden.jwks.fetch-timeout", defaultValue = "PT5S") Duration fetchTimeout,
            MeterRegistry meterRegistry) {
        this.webClient = WebClient.create(vertx);
        this.fetchTimeout = fetchTimeout;
        this.cache = Caffeine.newBuilder()
                .maximumSize(MAX_CACHE_ENTRIES)
                .expireAfterWrite(cacheTtl)
                .recordStats()
                .build();

        CaffeineCacheMetrics.monitor(meterRegistry, cache, "warden.jwks.cache");
    }

    @Override
    public Uni<JsonWebKeySet> getKeySet(URI jwksUri) {
        final var cached = cache.getIfPresent(jwksUri);
        if (cached != null) {
            LOG.debugv("Using cached JWKS for {0}", jwksUri);
            return Uni.createFrom().item(cached);
        }
        return getOrCreateFetch(jwksUri);
    }

    @Override
    public Uni<Optional<JsonWebKey>> getKey(URI jwksUri, String keyId) {
        return getKeySet(jwksUri).flatMap(keySet -> {
            final var key = findKey(keySet, keyId);
            if (key.isPresent()) {
                return Uni.createFrom().item(key);
            }
            LOG.infov("Key {0} not found, refreshing JWKS for {1}", keyId, jwksUri);
            return refresh(jwksUri).map(refreshed -> findKey(refreshed, keyId));
        });
    }

    @Override
    public Uni<JsonWebKeySet> refresh(URI jwksUri) {
        cache.invalidate(jwksUri);
        return getOrCreateFetch(jwksUri);
    }

    private Uni<JsonWebKeySet> getOrCreateFetch(URI jwksUri) {
        return Uni.createFrom().deferred(() -> inFlightFetches.computeIfAbsent(jwksUri, this::createFetch));
    }

    private Uni<JsonWebKeySet> createFetch(URI jwksUri) {
        return fetchAndCache(jwksUri)
                .onTermination()
                .invoke(() -> inFlightFetches.remove(jwksUri))
                .memoize()
                .indefinitely();
    }

    private Uni<JsonWebKeySet> fetchAndCache(URI jwksUri) {
        LOG.infov("Fetching JWKS from {0}", jwksUri);

        return webClient
                .getAbs(jwksUri.toString())
                .timeout(fetchTimeout.toMillis())
                .send()
                .map(this::parseResponse)
                .invoke(keySet -> {
                    cache.put(jwksUri, keySet);
                    LOG.infov("Cached {0} keys from {1}", keySet.getJsonWebKeys().size(), jwksUri);
                })
                .onFailure(error -> !(error instanceof BrokerException))
                .transform(error -> new UpstreamUnreachableException("Failed to fetch JWKS from " + jwksUri, error))
                .onFailure()
                .invoke(error -> LOG.errorv(error, "Failed to fetch JWKS from {0}", jwksUri));
    }

    private JsonWebKeySet parseResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new UpstreamMalformedResponseException(
                    "JWKS endpoint returned status " + response.statusCode(), response.statusCode());
        }

        try {
            return new JsonWebKeySet(response.bodyAsString());
        } catch (JoseException e) {
            throw new UpstreamMalformedResponseException("Failed to parse JWKS response: " + e.getMessage(), e);
        }
    }

    private static Optional<JsonWebKey> findKey(JsonWebKeySet keySet, String keyId) {
        if (keyId == null) {
            // Without a key ID only an unambiguous single-key set is usable
            final var keys = keySet.getJsonWebKeys();
            return keys.size() == 1 ? Optional.of(keys.get(0)) : Optional.empty();
        }

        return keySet.getJsonWebKeys().stream()
                .filter(key -> keyId.equals(key.getKeyId()))
                .findFirst();
    }
}
