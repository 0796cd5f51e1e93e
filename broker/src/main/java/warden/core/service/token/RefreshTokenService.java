package warden.core.service.token;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.exception.RefreshTokenRejectedException;
import warden.core.exception.StorageNotFoundException;
import warden.core.model.identity.Identity;
import warden.core.model.identity.Scopes;
import warden.core.model.storage.Claims;
import warden.core.model.storage.OfflineSessions;
import warden.core.model.storage.RefreshToken;
import warden.core.port.out.Metrics;
import warden.core.port.out.Storage;
import warden.core.service.connector.ConnectorRegistry;
import warden.core.util.Identifiers;
import warden.spi.Connector;

/**
 * Redeems refresh tokens and re-derives the identity behind them.
 *
 * <h2>Rotation</h2>
 * <p>Presenting the current bearer value rotates it: the old value becomes the obsolete
 * token and a new one is issued. Presenting the obsolete value is honoured within the reuse
 * interval after the rotation, so a client that lost the response to a concurrent refresh can
 * retry; it receives the already rotated value. Anything else is rejected.
 */
@ApplicationScoped
public class RefreshTokenService {

    private static final Logger LOG = Logger.getLogger(RefreshTokenService.class);

    static final String OUTCOME_ROTATED = "rotated";
    static final String OUTCOME_REUSED = "reused";
    static final String OUTCOME_REJECTED = "rejected";

    private static final int TOKEN_BYTES = 32;

    private final Storage storage;
    private final ConnectorRegistry connectors;
    private final RefreshTokenPolicy policy;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public RefreshTokenService(
            Storage storage, ConnectorRegistry connectors, RefreshTokenPolicy policy, Metrics metrics) {
        this(storage, connectors, policy, metrics, Clock.systemUTC());
    }

    RefreshTokenService(
            Storage storage, ConnectorRegistry connectors, RefreshTokenPolicy policy, Metrics metrics, Clock clock) {
        this.storage = storage;
        this.connectors = connectors;
        this.policy = policy;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Redeem a refresh token and refresh the identity it carries through its connector.
     *
     * @return the stored token, holding the bearer value to hand back and the refreshed claims
     */
    public Uni<RefreshToken> refresh(String id, String presentedToken) {
        return redeem(id, presentedToken).flatMap(token -> connectors
                .get(token.connectorId())
                .flatMap(connector -> refreshIdentity(connector, Scopes.of(token.scopes()), token)));
    }

    /**
     * Validate the presented bearer value and rotate the token when allowed.
     *
     * @throws RefreshTokenRejectedException (as a failure) if the token is unknown, expired or replayed
     */
    public Uni<RefreshToken> redeem(String id, String presentedToken) {
        final var now = clock.instant();
        final var outcome = new AtomicReference<String>();

        return storage.updateRefreshToken(id, stored -> {
                    final var result = redeemed(stored, presentedToken, now);
                    outcome.set(result == stored ? OUTCOME_REUSED : OUTCOME_ROTATED);
                    return result;
                })
                .onFailure(StorageNotFoundException.class)
                .transform(e -> new RefreshTokenRejectedException("refresh token " + id + " not found"))
                .invoke(token -> {
                    metrics.recordRefresh(outcome.get());
                    LOG.debugv("Refresh token {0} {1}", id, outcome.get());
                })
                .onFailure(RefreshTokenRejectedException.class)
                .invoke(e -> {
                    metrics.recordRefresh(OUTCOME_REJECTED);
                    LOG.infof("Rejected refresh token %s: %s", id, e.getMessage());
                });
    }

    RefreshToken redeemed(RefreshToken stored, String presentedToken, Instant now) {
        if (policy.expired(stored, now)) {
            throw new RefreshTokenRejectedException("refresh token " + stored.id() + " expired");
        }

        if (stored.token().equals(presentedToken)) {
            if (!policy.rotationEnabled()) {
                return stored.touch(now);
            }
            return stored.rotate(Identifiers.newSecret(TOKEN_BYTES), now);
        }

        if (!stored.obsoleteToken().isEmpty()
                && stored.obsoleteToken().equals(presentedToken)
                && policy.allowedToReuse(stored.lastUsed(), now)) {
            return stored;
        }

        throw new RefreshTokenRejectedException("refresh token " + stored.id() + " was already used");
    }

    /**
     * Ask the connector for a fresh identity and store the new claims and connector data.
     *
     * <p>When the token carries no connector data of its own, the data kept in the user's offline
     * session is used and the refreshed data is written back there.
     */
    public Uni<RefreshToken> refreshIdentity(Connector connector, Scopes scopes, RefreshToken token) {
        final var ownData = token.connectorData() != null && token.connectorData().length > 0;
        final Uni<byte[]> connectorData = ownData
                ? Uni.createFrom().item(token.connectorData())
                : sessionConnectorData(token);

        return connectorData
                .flatMap(data -> connector.refresh(scopes, token.claims().toIdentity(data)))
                .flatMap(identity -> storeIdentity(token, identity, ownData))
                .onFailure()
                .invoke(e -> LOG.warnf(
                        "Failed to refresh identity for token %s through connector %s: %s",
                        token.id(),
                        token.connectorId(),
                        e.getMessage()));
    }

    private Uni<byte[]> sessionConnectorData(RefreshToken token) {
        return storage.getOfflineSessions(token.claims().userId(), token.connectorId())
                .map(OfflineSessions::connectorData)
                .onFailure(StorageNotFoundException.class)
                .recoverWithNull();
    }

    private Uni<RefreshToken> storeIdentity(RefreshToken token, Identity identity, boolean ownData) {
        final var claims = Claims.from(identity);
        final var newData = identity.connectorData();

        return storage.updateRefreshToken(
                        token.id(), stored -> stored.withIdentity(claims, ownData ? newData : stored.connectorData()))
                .flatMap(updated -> storage.updateOfflineSessions(
                                token.claims().userId(), token.connectorId(), sessions -> {
                                    final var touched = sessions.withRefresh(updated.toRef());
                                    return ownData || newData == null ? touched : touched.withConnectorData(newData);
                                })
                        .onFailure(StorageNotFoundException.class)
                        .recoverWithNull()
                        .replaceWith(updated));
    }
}
