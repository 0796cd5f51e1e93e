package warden.core.port.out;

import java.net.URI;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;

/**
 * Port for caching and retrieving JSON Web Key Sets (JWKS) of upstream providers.
 */
public interface JwksCache {

    /**
     * Get the key set, from cache when fresh, otherwise from the endpoint.
     */
    Uni<JsonWebKeySet> getKeySet(URI jwksUri);

    /**
     * Get a specific key by ID, forcing one refresh when the key is unknown (upstream rotation).
     *
     * @param keyId the key ID (kid), or null to accept a single-key set
     */
    Uni<Optional<JsonWebKey>> getKey(URI jwksUri, String keyId);

    /**
     * Force refresh keys from the remote endpoint.
     */
    Uni<JsonWebKeySet> refresh(URI jwksUri);
}
