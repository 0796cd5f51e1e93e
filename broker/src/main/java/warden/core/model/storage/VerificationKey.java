package warden.core.model.storage;

import java.time.Instant;
import java.util.Objects;

import org.jose4j.jwk.PublicJsonWebKey;

/**
 * A previously active public key, kept to verify tokens signed before the last rotation.
 */
public record VerificationKey(PublicJsonWebKey publicKey, Instant expiry) {

    public VerificationKey {
        Objects.requireNonNull(publicKey, "publicKey is required");
        Objects.requireNonNull(expiry, "expiry is required");
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiry);
    }
}
