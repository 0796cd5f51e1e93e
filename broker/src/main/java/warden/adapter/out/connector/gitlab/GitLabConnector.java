package warden.adapter.out.connector.gitlab;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import warden.adapter.out.connector.LinkHeader;
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
 * Logs users in through GitLab (gitlab.com or self-managed).
 *
 * <p>Profile data comes from {@code /api/v4/user}. Groups are fetched only when an allow-list
 * is configured or the client asked for the groups scope.
 */
public class GitLabConnector implements Connector {

    static final String TYPE = "gitlab";

    private static final Logger LOG = Logger.getLogger(GitLabConnector.class);

    private static final String SCOPE_USER = "read_user";
    private static final String SCOPE_OPENID = "openid";
    private static final String SCOPE_READ_API = "read_api";
    private static final String ROLE_CLAIM_PREFIX = "https://gitlab.org/claims/groups/";

    // Highest role first; userinfo only reports these three
    private static final List<GitLabAccessLevel> USERINFO_ROLES =
            List.of(GitLabAccessLevel.OWNER, GitLabAccessLevel.MAINTAINER, GitLabAccessLevel.DEVELOPER);

    private final String id;
    private final GitLabConnectorConfig config;
    private final OAuth2Client oauth;
    private final ObjectMapper objectMapper;

    GitLabConnector(String id, GitLabConnectorConfig config, OAuth2Client oauth, ObjectMapper objectMapper) {
        this.id = id;
        this.config = config;
        this.oauth = oauth;
        this.objectMapper = objectMapper;
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
        params.put("scope", String.join(" ", requestScopes(scopes)));
        params.put("state", state);
        return LoginRedirect.to(OAuth2Client.authorizeUrl(config.baseUrl() + "/oauth/authorize", params));
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

        return oauth.exchangeCode(code.get(), config.redirectUri()).flatMap(token -> identity(scopes, token));
    }

    @Override
    public Uni<Identity> refresh(Scopes scopes, Identity identity) {
        final GitLabConnectorData data;
        try {
            data = readConnectorData(identity.connectorData());
        } catch (ConfigurationException e) {
            return Uni.createFrom().failure(e);
        }

        if (data.hasRefreshToken()) {
            LOG.debugv("{0}: refreshing identity of {1} with refresh token", id, identity.userId());
            return oauth.refresh(data.refreshToken())
                    .map(token -> token.withFallbackRefreshToken(data.refreshToken()))
                    .flatMap(token -> identity(scopes, token));
        }
        if (data.hasAccessToken()) {
            LOG.debugv("{0}: refreshing identity of {1} with stored access token", id, identity.userId());
            return identity(scopes, OAuth2Token.ofAccessToken(data.accessToken()));
        }
        return Uni.createFrom().failure(new ConfigurationException("no refresh or access token found"));
    }

    boolean groupsRequired(Scopes scopes) {
        return !config.groups().isEmpty() || scopes.groups();
    }

    List<String> requestScopes(Scopes scopes) {
        if (groupsRequired(scopes)) {
            return List.of(SCOPE_USER, SCOPE_OPENID, SCOPE_READ_API);
        }
        return List.of(SCOPE_USER);
    }

    private Uni<Identity> identity(Scopes scopes, OAuth2Token token) {
        return oauth.getJsonObject(config.baseUrl() + "/api/v4/user", token.accessToken())
                .flatMap(user -> {
                    final var identity = toIdentity(user);
                    if (!groupsRequired(scopes)) {
                        return Uni.createFrom().item(identity);
                    }
                    return fetchGroups(token.accessToken(), user.getLong("id"))
                            .map(groups -> identity.withGroups(applyAllowList(scopes, groups, identity)));
                })
                .map(identity -> scopes.offlineAccess()
                        ? identity.withConnectorData(writeConnectorData(token))
                        : identity);
    }

    private Identity toIdentity(JsonObject user) {
        final var numericId = user.getValue("id");
        if (!(numericId instanceof Number)) {
            throw new UpstreamMalformedResponseException("gitlab: user response has no numeric id", 200);
        }
        final var login = user.getString("username");
        final var email = user.getString("email");
        final var userId = config.useLoginAsId() ? login : String.valueOf(((Number) numericId).longValue());
        if (userId == null) {
            throw new UpstreamMalformedResponseException("gitlab: user response has no username", 200);
        }
        final var username = Identity.displayName(user.getString("name"), email);
        if (username == null || username.isEmpty()) {
            throw new UpstreamMalformedResponseException("gitlab: user has neither name nor email", 200);
        }
        return new Identity(userId, username, login, email, true, List.of(), null);
    }

    private List<String> applyAllowList(Scopes scopes, List<String> resolved, Identity identity) {
        if (!config.groups().isEmpty()) {
            final var filtered = Groups.filter(resolved, config.groups());
            if (filtered.isEmpty()) {
                LOG.infov("{0}: user {1} is not in any allowed group", id, identity.preferredUsername());
                throw new GroupPolicyViolationException(TYPE, identity.preferredUsername());
            }
            return filtered;
        }
        return scopes.groups() ? resolved : List.of();
    }

    private Uni<List<String>> fetchGroups(String accessToken, long numericUserId) {
        return switch (config.groupsSource()) {
            case USERINFO -> userinfoGroups(accessToken);
            case MEMBERSHIP -> membershipGroups(accessToken, numericUserId);
        };
    }

    // ---------------------------------------------------------------------------------------
    // Membership probing

    private Uni<List<String>> membershipGroups(String accessToken, long numericUserId) {
        return listGroups(accessToken, config.baseUrl() + "/api/v4/groups", new HashSet<>(), new ArrayList<>())
                .flatMap(groups -> Multi.createFrom()
                        .iterable(groups)
                        .onItem()
                        .transformToUniAndConcatenate(group -> membershipEntries(accessToken, group, numericUserId))
                        .collect()
                        .asList())
                .map(entries -> {
                    final var result = new ArrayList<String>();
                    entries.forEach(result::addAll);
                    LOG.debugv("{0}: resolved {1} group entries for user {2}", id, result.size(), numericUserId);
                    return result;
                });
    }

    private Uni<List<JsonObject>> listGroups(
            String accessToken, String url, Set<String> visited, List<JsonObject> collected) {
        visited.add(url);
        return oauth.get(url, accessToken).flatMap(response -> {
            oauth.requireOk(response, url);
            final JsonArray page = oauth.jsonArray(response);
            for (int i = 0; i < page.size(); i++) {
                collected.add(page.getJsonObject(i));
            }

            final var link = response.getHeader("Link");
            final var last = LinkHeader.last(link);
            final var next = LinkHeader.next(link);
            if (next.isEmpty()
                    || last.filter(url::equals).isPresent()
                    || visited.contains(next.get())) {
                return Uni.createFrom().item(collected);
            }
            return listGroups(accessToken, next.get(), visited, collected);
        });
    }

    private Uni<List<String>> membershipEntries(String accessToken, JsonObject group, long numericUserId) {
        final var fullPath = group.getString("full_path");
        final var url = "%s/api/v4/groups/%s/members/all/%s"
                .formatted(config.baseUrl(), group.getValue("id"), numericUserId);
        return oauth.get(url, accessToken).map(response -> {
            if (response.statusCode() != 200) {
                return List.<String>of();
            }
            final var member = oauth.jsonObject(response);
            final var accessLevel = member.getValue("access_level");
            if (!(accessLevel instanceof Number level)) {
                return List.<String>of();
            }
            return withRole(fullPath, GitLabAccessLevel.fromLevel(level.intValue()));
        });
    }

    private List<String> withRole(String path, Optional<GitLabAccessLevel> level) {
        if (!config.getGroupsPermission() || level.isEmpty()) {
            return List.of(path);
        }
        return List.of(path, path + ":" + level.get().role());
    }

    // ---------------------------------------------------------------------------------------
    // Userinfo claims

    private Uni<List<String>> userinfoGroups(String accessToken) {
        return oauth.getJsonObject(config.baseUrl() + "/oauth/userinfo", accessToken)
                .map(userinfo -> {
                    final var groups = stringList(userinfo.getJsonArray("groups"));
                    final var result = new ArrayList<String>();
                    for (String group : groups) {
                        result.addAll(withRole(group, highestUserinfoRole(userinfo, group)));
                    }
                    return result;
                });
    }

    private static Optional<GitLabAccessLevel> highestUserinfoRole(JsonObject userinfo, String group) {
        for (var role : USERINFO_ROLES) {
            if (stringList(userinfo.getJsonArray(ROLE_CLAIM_PREFIX + role.role())).contains(group)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    private static List<String> stringList(JsonArray array) {
        if (array == null) {
            return List.of();
        }
        final var values = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            if (array.getValue(i) instanceof String value) {
                values.add(value);
            }
        }
        return values;
    }

    // ---------------------------------------------------------------------------------------
    // Connector data

    private byte[] writeConnectorData(OAuth2Token token) {
        try {
            return objectMapper.writeValueAsBytes(new GitLabConnectorData(token.accessToken(), token.refreshToken()));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("gitlab: marshal connector data: " + e.getMessage(), e);
        }
    }

    private GitLabConnectorData readConnectorData(byte[] data) {
        if (data == null || data.length == 0) {
            throw new ConfigurationException("no refresh or access token found");
        }
        try {
            return objectMapper.readValue(data, GitLabConnectorData.class);
        } catch (IOException e) {
            throw new ConfigurationException("gitlab: unmarshal connector data: " + e.getMessage(), e);
        }
    }
}
