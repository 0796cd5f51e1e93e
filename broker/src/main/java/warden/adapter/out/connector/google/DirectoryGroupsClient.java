package warden.adapter.out.connector.google;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import warden.adapter.out.connector.OAuth2Client;
import warden.core.exception.ConfigurationException;

/**
 * Lists Workspace group memberships through the Admin SDK Directory API.
 *
 * <p>Group emails are the group identifiers. With transitive resolution a group's own
 * memberships are listed by using the group email as the user key; a visited set shared by
 * the whole resolution is consulted before recursing, so membership cycles terminate and each
 * group is reported once.
 */
class DirectoryGroupsClient {

    private static final Logger LOG = Logger.getLogger(DirectoryGroupsClient.class);

    private final OAuth2Client api;
    private final String directoryUrl;
    private final Map<String, String> adminBindings;
    private final ServiceAccountTokenSource tokens;

    DirectoryGroupsClient(
            OAuth2Client api,
            String directoryUrl,
            Map<String, String> adminBindings,
            ServiceAccountTokenSource tokens) {
        this.api = api;
        this.directoryUrl = directoryUrl;
        this.adminBindings = Map.copyOf(adminBindings);
        this.tokens = tokens;
    }

    Uni<List<String>> groupsOf(String email, boolean transitive) {
        final Set<String> visited = ConcurrentHashMap.newKeySet();
        return groupsOf(email, transitive, visited);
    }

    private Uni<List<String>> groupsOf(String userKey, boolean transitive, Set<String> visited) {
        return Uni.createFrom()
                .item(() -> adminFor(domainOf(userKey)))
                .flatMap(tokens::accessToken)
                .flatMap(token -> listPages(userKey, token, null, new ArrayList<>()))
                .flatMap(direct -> Multi.createFrom()
                        .iterable(direct)
                        .onItem()
                        .transformToUniAndConcatenate(group -> {
                            if (!visited.add(group)) {
                                return Uni.createFrom().item(List.<String>of());
                            }
                            if (!transitive) {
                                return Uni.createFrom().item(List.of(group));
                            }
                            return groupsOf(group, true, visited).map(nested -> {
                                final var withNested = new ArrayList<String>(nested.size() + 1);
                                withNested.add(group);
                                withNested.addAll(nested);
                                return withNested;
                            });
                        })
                        .collect()
                        .asList())
                .map(lists -> {
                    final var result = new ArrayList<String>();
                    lists.forEach(result::addAll);
                    return result;
                });
    }

    private Uni<List<String>> listPages(String userKey, String token, String pageToken, List<String> collected) {
        var url = directoryUrl + "/admin/directory/v1/groups?userKey=" + OAuth2Client.urlEncode(userKey);
        if (pageToken != null) {
            url += "&pageToken=" + OAuth2Client.urlEncode(pageToken);
        }

        return api.getJsonObject(url, token).flatMap(page -> {
            final var groups = page.getJsonArray("groups");
            if (groups != null) {
                for (int i = 0; i < groups.size(); i++) {
                    final var group = groups.getValue(i);
                    if (group instanceof JsonObject object && object.getString("email") != null) {
                        collected.add(object.getString("email"));
                    }
                }
            }

            final var next = page.getString("nextPageToken");
            if (next == null || next.isEmpty()) {
                return Uni.createFrom().item(collected);
            }
            return listPages(userKey, token, next, collected);
        });
    }

    String adminFor(String domain) {
        final var admin = adminBindings.get(domain);
        if (admin != null) {
            return admin;
        }
        final var wildcard = adminBindings.get(GoogleConnectorConfig.WILDCARD_DOMAIN);
        if (wildcard != null) {
            LOG.debugv("Using wildcard admin email {0} to fetch groups", wildcard);
            return wildcard;
        }
        throw new ConfigurationException(
                "unable to find super admin email, domainToAdminEmail for domain: %s not set, %s is also empty"
                        .formatted(domain, GoogleConnectorConfig.WILDCARD_DOMAIN));
    }

    /**
     * The text after the last {@code @}, or the wildcard for values without one.
     */
    static String domainOf(String email) {
        if (email == null) {
            return GoogleConnectorConfig.WILDCARD_DOMAIN;
        }
        final var at = email.lastIndexOf('@');
        return at >= 0 ? email.substring(at + 1) : GoogleConnectorConfig.WILDCARD_DOMAIN;
    }
}
