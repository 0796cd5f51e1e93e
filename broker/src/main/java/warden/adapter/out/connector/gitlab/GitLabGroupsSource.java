package warden.adapter.out.connector.gitlab;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where the GitLab connector reads group memberships from.
 */
public enum GitLabGroupsSource {
    /**
     * Page through {@code /api/v4/groups} and probe the user's membership in each group.
     */
    @JsonProperty("membership")
    MEMBERSHIP,

    /**
     * Read the {@code groups} claim of {@code /oauth/userinfo}; one request per login.
     */
    @JsonProperty("userinfo")
    USERINFO
}
