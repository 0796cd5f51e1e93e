package warden.adapter.out.connector.google;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.lang.JoseException;

import warden.adapter.out.connector.OAuth2Client;
import warden.core.exception.ConfigurationException;

/**
 * Issues Admin Directory access tokens for a service account impersonating a Workspace admin.
 *
 * <p>Uses the JWT bearer grant (RFC 7523): an RS256 assertion signed with the service account
 * key, {@code sub} set to the impersonated admin. Tokens are cached per admin until shortly
 * before they expire.
 */
class ServiceAccountTokenSource {

    private static final Logger LOG = Logger.getLogger(ServiceAccountTokenSource.class);

    static final String DIRECTORY_SCOPE = "https://www.googleapis.com/auth/admin.directory.group.readonly";
    private static final String JWT_BEARER_GRANT = "urn:ietf:params:oauth:grant-type:jwt-bearer";
    private static final Duration ASSERTION_LIFETIME = Duration.ofHours(1);
    private static final Duration EXPIRY_MARGIN = Duration.ofMinutes(1);

    private final ServiceAccountCredentials credentials;
    private final OAuth2Client tokenClient;
    private final Map<String, CachedToken> tokens = new ConcurrentHashMap<>();

    ServiceAccountTokenSource(WebClient webClient, ServiceAccountCredentials credentials, Duration timeout) {
        this.credentials = credentials;
        this.tokenClient =
                new OAuth2Client(webClient, GoogleConnector.TYPE, credentials.tokenUri(), null, null, timeout);
    }

    /**
     * @param adminEmail the Workspace admin to impersonate
     */
    Uni<String> accessToken(String adminEmail) {
        final var cached = tokens.get(adminEmail);
        if (cached != null && Instant.now().isBefore(cached.expiresAt().minus(EXPIRY_MARGIN))) {
            return Uni.createFrom().item(cached.accessToken());
        }

        return Uni.createFrom()
                .item(() -> assertion(adminEmail))
                .flatMap(assertion -> {
                    final var grant = new LinkedHashMap<String, String>();
                    grant.put("grant_type", JWT_BEARER_GRANT);
                    grant.put("assertion", assertion);
                    return tokenClient.requestToken(grant);
                })
                .map(token -> {
                    tokens.put(
                            adminEmail,
                            new CachedToken(token.accessToken(), Instant.now().plusSeconds(token.expiresIn())));
                    LOG.debugv("Obtained directory token impersonating {0}", adminEmail);
                    return token.accessToken();
                });
    }

    String assertion(String adminEmail) {
        final var now = Instant.now();
        final var claims = new JwtClaims();
        claims.setIssuer(credentials.clientEmail());
        claims.setSubject(adminEmail);
        claims.setAudience(credentials.tokenUri());
        claims.setClaim("scope", DIRECTORY_SCOPE);
        claims.setIssuedAt(NumericDate.fromSeconds(now.getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(now.plus(ASSERTION_LIFETIME).getEpochSecond()));

        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(credentials.privateKey());
        if (credentials.keyId() != null) {
            jws.setKeyIdHeaderValue(credentials.keyId());
        }
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new ConfigurationException("unable to sign service account assertion: " + e.getMessage(), e);
        }
    }

    private record CachedToken(String accessToken, Instant expiresAt) {}
}
