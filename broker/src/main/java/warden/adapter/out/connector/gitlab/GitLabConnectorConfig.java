package warden.adapter.out.connector.gitlab;

import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON configuration of a GitLab connector.
 *
 * @param baseUrl             GitLab instance, defaults to {@code https://gitlab.com}
 * @param groups              allow-list; when non-empty only members of these groups may log in
 * @param useLoginAsId        use the username instead of the numeric user id as {@code userId}
 * @param getGroupsPermission also report {@code group:role} entries
 * @param groupsSource        where memberships are read from
 * @param timeout             ISO-8601 duration bounding each upstream request
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitLabConnectorConfig(
        @JsonProperty("baseURL") String baseUrl,
        @JsonProperty("clientID") String clientId,
        @JsonProperty("clientSecret") String clientSecret,
        @JsonProperty("redirectURI") String redirectUri,
        @JsonProperty("groups") List<String> groups,
        @JsonProperty("useLoginAsID") boolean useLoginAsId,
        @JsonProperty("getGroupsPermission") boolean getGroupsPermission,
        @JsonProperty("groupsSource") GitLabGroupsSource groupsSource,
        @JsonProperty("timeout") String timeout) {

    static final String DEFAULT_BASE_URL = "https://gitlab.com";
    static final String DEFAULT_TIMEOUT = "PT10S";

    public GitLabConnectorConfig {
        baseUrl = baseUrl == null || baseUrl.isEmpty() ? DEFAULT_BASE_URL : baseUrl;
        redirectUri = redirectUri != null ? redirectUri : "";
        groups = groups != null ? List.copyOf(groups) : List.of();
        groupsSource = groupsSource != null ? groupsSource : GitLabGroupsSource.MEMBERSHIP;
        timeout = timeout == null || timeout.isEmpty() ? DEFAULT_TIMEOUT : timeout;
    }

    public Duration requestTimeout() {
        return Duration.parse(timeout);
    }
}
