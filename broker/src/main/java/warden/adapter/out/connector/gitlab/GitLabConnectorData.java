package warden.adapter.out.connector.gitlab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Upstream tokens kept with an offline session so the identity can be refreshed later.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record GitLabConnectorData(String accessToken, String refreshToken) {

    boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    boolean hasAccessToken() {
        return accessToken != null && !accessToken.isEmpty();
    }
}
