package warden.adapter.out.connector;

/**
 * Token endpoint response of an upstream OAuth 2.0 provider.
 *
 * @param refreshToken null when the provider issued none
 * @param idToken      raw compact JWS, null for plain OAuth 2.0 providers
 * @param expiresIn    lifetime of the access token in seconds
 */
public record OAuth2Token(String accessToken, String refreshToken, String idToken, String tokenType, long expiresIn) {

    public static OAuth2Token ofAccessToken(String accessToken) {
        return new OAuth2Token(accessToken, null, null, "Bearer", 0);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    /**
     * Keep a previous refresh token when the provider did not rotate it.
     */
    public OAuth2Token withFallbackRefreshToken(String previous) {
        if (hasRefreshToken()) {
            return this;
        }
        return new OAuth2Token(accessToken, previous, idToken, tokenType, expiresIn);
    }
}
