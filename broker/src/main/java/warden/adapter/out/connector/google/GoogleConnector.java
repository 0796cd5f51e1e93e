package warden.adapter.out.connector.google;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;

import warden.adapter.out.connector.OAuth2Client;
import warden.adapter.out.connector.OAuth2Token;
import warden.core.exception.ConfigurationException;
import warden.core.exception.GroupPolicyViolationException;
import warden.core.exception.UpstreamMalformedResponseException;
import warden.core.exception.UpstreamRejectedException;
import warden.core.model.identity.CallbackRequest;
import warden.core.model.identity.Identity;
import warden.core.model.identity.LoginRedirect;
import warden.core.model.identity.Scopes;
import warden.core.util.Groups;
import warden.spi.Connector;

/**
 * Logs users in through Google's OpenID Connect provider.
 *
 * <p>Identity claims come from the verified ID token. Workspace groups are resolved through the
 * Directory API, and only when at least one admin binding is configured.
 */
public class GoogleConnector implements Connector {

    static final String TYPE = "google";

    private static final Logger LOG = Logger.getLogger(GoogleConnector.class);

    private final String id;
    private final GoogleConnectorConfig config;
    private final OAuth2Client oauth;
    private final IdTokenVerifier verifier;
    private final DirectoryGroupsClient directory;

    /**
     * @param directory null when no admin binding is configured
     */
    GoogleConnector(
            String id,
            GoogleConnectorConfig config,
            OAuth2Client oauth,
            IdTokenVerifier verifier,
            DirectoryGroupsClient directory) {
        this.id = id;
        this.config = config;
        this.oauth = oauth;
        this.verifier = verifier;
        this.directory = directory;
    }

    @Override
    public LoginRedirect loginUrl(Scopes scopes, String callbackUrl, String state) {
        if (!config.redirectUri().equals(callbackUrl)) {
            throw new ConfigurationException("expected callback URL \"%s\" did not match the URL in the config \"%s\""
                    .formatted(config.redirectUri(), callbackUrl));
        }

        final var params = new LinkedHashMap<String, String>();
        params.put("client_id", config.clientId());
        params.put("redirect_uri", config.redirectUri());
        params.put("response_type", "code");
        params.put("scope", String.join(" ", config.requestScopes()));
        params.put("state", state);
        if (!config.hostedDomains().isEmpty()) {
            params.put("hd", config.hostedDomains().size() == 1 ? config.hostedDomains().get(0) : "*");
        }
        if (scopes.offlineAccess()) {
            params.put("access_type", "offline");
            params.put("prompt", "consent");
        }
        return LoginRedirect.to(OAuth2Client.authorizeUrl(config.authUrl(), params));
    }

    @Override
    public Uni<Identity> handleCallback(Scopes scopes, byte[] continuation, CallbackRequest request) {
        final var error = request.error();
        if (error.isPresent()) {
            return Uni.createFrom()
                    .failure(new UpstreamRejectedException(
                            error.get(), request.errorDescription().orElse(null)));
        }
        final var code = request.code();
        if (code.isEmpty()) {
            return Uni.createFrom()
                    .failure(new UpstreamRejectedException("invalid_request", "callback carries no code"));
        }

        return oauth.exchangeCode(code.get(), config.redirectUri()).flatMap(this::identity);
    }

    @Override
    public Uni<Identity> refresh(Scopes scopes, Identity identity) {
        final var data = identity.connectorData();
        if (data == null || data.length == 0) {
            return Uni.createFrom().failure(new ConfigurationException("google: no refresh token found"));
        }
        final var refreshToken = new String(data, StandardCharsets.UTF_8);

        LOG.debugv("{0}: refreshing identity of {1}", id, identity.userId());
        return oauth.refresh(refreshToken)
                .map(token -> token.withFallbackRefreshToken(refreshToken))
                .flatMap(this::identity);
    }

    private Uni<Identity> identity(OAuth2Token token) {
        if (token.idToken() == null || token.idToken().isEmpty()) {
            return Uni.createFrom()
                    .failure(new UpstreamMalformedResponseException("google: no id_token in token response", 200));
        }

        return verifier.verify(token.idToken()).map(this::toIdentity).flatMap(identity -> {
            final var connectorData =
                    token.hasRefreshToken() ? token.refreshToken().getBytes(StandardCharsets.UTF_8) : null;
            final var withData = identity.withConnectorData(connectorData);
            if (directory == null) {
                return Uni.createFrom().item(withData);
            }
            return directory
                    .groupsOf(identity.email(), config.fetchTransitiveGroupMembership())
                    .map(groups -> withData.withGroups(applyAllowList(groups, identity)));
        });
    }

    private Identity toIdentity(JwtClaims claims) {
        try {
            final var hostedDomain = claims.getStringClaimValue("hd");
            if (!config.hostedDomains().isEmpty() && !config.hostedDomains().contains(hostedDomain)) {
                LOG.infov("{0}: rejected login from hosted domain {1}", id, hostedDomain);
                throw new UpstreamRejectedException("unexpected hd claim " + hostedDomain, null);
            }

            final var subject = claims.getSubject();
            if (subject == null || subject.isEmpty()) {
                throw new UpstreamMalformedResponseException("google: ID token has no sub claim", 200);
            }
            final var email = claims.getStringClaimValue("email");
            if (email == null || email.isEmpty()) {
                throw new UpstreamMalformedResponseException("google: ID token has no email claim", 200);
            }
            final var username = Identity.displayName(claims.getStringClaimValue("name"), email);
            if (username == null || username.isEmpty()) {
                throw new UpstreamMalformedResponseException("google: ID token has neither name nor email", 200);
            }
            return new Identity(
                    subject, username, null, email, emailVerified(claims), List.of(), null);
        } catch (MalformedClaimException e) {
            throw new UpstreamMalformedResponseException("google: failed to decode claims: " + e.getMessage(), e);
        }
    }

    private static boolean emailVerified(JwtClaims claims) {
        final var value = claims.getClaimValue("email_verified");
        if (value instanceof Boolean verified) {
            return verified;
        }
        return value instanceof String text && Boolean.parseBoolean(text);
    }

    private List<String> applyAllowList(List<String> resolved, Identity identity) {
        if (config.groups().isEmpty()) {
            return resolved;
        }
        final var filtered = Groups.filter(resolved, config.groups());
        if (filtered.isEmpty()) {
            LOG.infov("{0}: user {1} is not in any allowed group", id, identity.username());
            throw new GroupPolicyViolationException(TYPE, identity.username());
        }
        return filtered;
    }
}
