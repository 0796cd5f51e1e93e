package warden.core.model.storage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.jose4j.jwk.PublicJsonWebKey;

/**
 * Process-wide signing key material. There is a single logical row per deployment.
 *
 * @param signingKey       current private signing key, null before the first rotation
 * @param signingKeyPub    public half of {@code signingKey}
 * @param verificationKeys previously active public keys, oldest first
 * @param nextRotation     when the signing key is due for rotation
 */
public record Keys(
        PublicJsonWebKey signingKey,
        PublicJsonWebKey signingKeyPub,
        List<VerificationKey> verificationKeys,
        Instant nextRotation) {

    public Keys {
        verificationKeys = verificationKeys != null ? List.copyOf(verificationKeys) : List.of();
        nextRotation = nextRotation != null ? nextRotation : Instant.EPOCH;
    }

    /**
     * Value handed to the updater when no keys have been stored yet.
     */
    public static Keys empty() {
        return new Keys(null, null, List.of(), Instant.EPOCH);
    }

    public Optional<PublicJsonWebKey> currentSigningKey() {
        return Optional.ofNullable(signingKey);
    }
}
