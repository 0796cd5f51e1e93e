package warden.adapter.out.connector.google;

import java.net.URI;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import warden.core.exception.UpstreamMalformedResponseException;
import warden.core.port.out.JwksCache;

/**
 * Verifies Google ID tokens: RS256 signature against the provider JWKS, issuer, audience and
 * expiry.
 */
class IdTokenVerifier {

    private static final Logger LOG = Logger.getLogger(IdTokenVerifier.class);
    private static final int CLOCK_SKEW_SECONDS = 30;

    // Google issues tokens with and without the scheme
    private static final String LEGACY_GOOGLE_ISSUER = "accounts.google.com";

    private final JwksCache jwksCache;
    private final URI jwksUri;
    private final List<String> issuers;
    private final String clientId;

    IdTokenVerifier(JwksCache jwksCache, URI jwksUri, String issuer, String clientId) {
        this.jwksCache = jwksCache;
        this.jwksUri = jwksUri;
        this.issuers = GoogleConnectorConfig.DEFAULT_ISSUER.equals(issuer)
                ? List.of(issuer, LEGACY_GOOGLE_ISSUER)
                : List.of(issuer);
        this.clientId = clientId;
    }

    Uni<JwtClaims> verify(String rawIdToken) {
        return Uni.createFrom()
                .item(() -> keyId(rawIdToken))
                .flatMap(keyId -> jwksCache.getKey(jwksUri, keyId))
                .map(key -> validate(
                        rawIdToken,
                        key.orElseThrow(() -> new UpstreamMalformedResponseException(
                                "google: ID token signed with an unknown key", 200))));
    }

    private static String keyId(String rawIdToken) {
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(rawIdToken);
            return jws.getKeyIdHeaderValue();
        } catch (JoseException e) {
            throw new UpstreamMalformedResponseException("google: failed to parse ID token: " + e.getMessage(), e);
        }
    }

    private JwtClaims validate(String rawIdToken, JsonWebKey key) {
        try {
            return new JwtConsumerBuilder()
                    .setRequireSubject()
                    .setRequireExpirationTime()
                    .setAllowedClockSkewInSeconds(CLOCK_SKEW_SECONDS)
                    .setExpectedIssuers(true, issuers.toArray(new String[0]))
                    .setExpectedAudience(clientId)
                    .setVerificationKey(key.getKey())
                    .build()
                    .processToClaims(rawIdToken);
        } catch (InvalidJwtException e) {
            LOG.debugv("ID token validation failed: {0}", e.getMessage());
            throw new UpstreamMalformedResponseException("google: failed to verify ID Token: " + e.getMessage(), e);
        }
    }
}
