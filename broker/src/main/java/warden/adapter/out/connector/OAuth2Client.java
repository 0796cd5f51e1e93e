package warden.adapter.out.connector;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.core.exception.BrokerException;
import warden.core.exception.UpstreamMalformedResponseException;
import warden.core.exception.UpstreamRejectedException;
import warden.core.exception.UpstreamUnreachableException;

/**
 * Minimal OAuth 2.0 client for one upstream provider (RFC 6749).
 *
 * <p>Supports:
 * <ul>
 *   <li>Authorization code exchange</li>
 *   <li>Refresh token grant</li>
 *   <li>Arbitrary grants such as the JWT bearer assertion (RFC 7523)</li>
 *   <li>Bearer-authenticated GET requests against the provider's API</li>
 * </ul>
 *
 * <p>Client credentials are sent with {@code client_secret_basic} when a secret is configured.
 * Transport failures become {@link UpstreamUnreachableException}; nothing is retried.
 */
public class OAuth2Client {

    private static final Logger LOG = Logger.getLogger(OAuth2Client.class);
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600L;

    private final WebClient webClient;
    private final String connectorType;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final long timeoutMillis;

    public OAuth2Client(
            WebClient webClient,
            String connectorType,
            String tokenUrl,
            String clientId,
            String clientSecret,
            Duration timeout) {
        this.webClient = webClient;
        this.connectorType = connectorType;
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.timeoutMillis = timeout.toMillis();
    }

    /**
     * Build an authorization request URL from the given query parameters, in order.
     */
    public static String authorizeUrl(String authUrl, Map<String, String> params) {
        final var separator = authUrl.contains("?") ? "&" : "?";
        return authUrl + separator + formEncode(params);
    }

    public static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    public static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public Uni<OAuth2Token> exchangeCode(String code, String redirectUri) {
        final var params = new LinkedHashMap<String, String>();
        params.put("grant_type", "authorization_code");
        params.put("code", code);
        params.put("redirect_uri", redirectUri);
        return requestToken(params);
    }

    public Uni<OAuth2Token> refresh(String refreshToken) {
        final var params = new LinkedHashMap<String, String>();
        params.put("grant_type", "refresh_token");
        params.put("refresh_token", refreshToken);
        return requestToken(params);
    }

    /**
     * POST the given grant to the token endpoint.
     */
    public Uni<OAuth2Token> requestToken(Map<String, String> grant) {
        LOG.debugf("%s: requesting token (%s) from %s", connectorType, grant.get("grant_type"), tokenUrl);

        final var params = new LinkedHashMap<>(grant);
        if (clientId != null) {
            // Some providers require client_id in the body even with basic auth
            params.put("client_id", clientId);
        }

        var request = webClient
                .postAbs(tokenUrl)
                .timeout(timeoutMillis)
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json");

        if (clientId != null && clientSecret != null) {
            final var credentials = urlEncode(clientId) + ":" + urlEncode(clientSecret);
            final var encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
            request = request.putHeader("Authorization", "Basic " + encoded);
        }

        return transport(request.sendBuffer(Buffer.buffer(formEncode(params))), "token request")
                .map(this::parseTokenResponse);
    }

    /**
     * GET an API resource with the access token as bearer credential.
     */
    public Uni<HttpResponse<Buffer>> get(String url, String accessToken) {
        return transport(
                webClient
                        .getAbs(url)
                        .timeout(timeoutMillis)
                        .putHeader("Accept", "application/json")
                        .putHeader("Authorization", "Bearer " + accessToken)
                        .send(),
                "GET " + url);
    }

    /**
     * GET an API resource that must answer 200 with a JSON object.
     */
    public Uni<JsonObject> getJsonObject(String url, String accessToken) {
        return get(url, accessToken).map(response -> {
            requireOk(response, url);
            return jsonObject(response);
        });
    }

    public void requireOk(HttpResponse<Buffer> response, String url) {
        if (response.statusCode() != 200) {
            LOG.warnf("%s: GET %s returned status %d", connectorType, url, response.statusCode());
            throw new UpstreamMalformedResponseException(
                    "%s: %s returned status %d".formatted(connectorType, url, response.statusCode()),
                    response.statusCode());
        }
    }

    public JsonObject jsonObject(HttpResponse<Buffer> response) {
        try {
            final var json = response.bodyAsJsonObject();
            if (json == null) {
                throw new UpstreamMalformedResponseException(connectorType + ": empty response body", 200);
            }
            return json;
        } catch (RuntimeException e) {
            if (e instanceof BrokerException broker) {
                throw broker;
            }
            throw new UpstreamMalformedResponseException(connectorType + ": failed to decode response", e);
        }
    }

    public JsonArray jsonArray(HttpResponse<Buffer> response) {
        try {
            final var json = response.bodyAsJsonArray();
            if (json == null) {
                throw new UpstreamMalformedResponseException(connectorType + ": empty response body", 200);
            }
            return json;
        } catch (RuntimeException e) {
            if (e instanceof BrokerException broker) {
                throw broker;
            }
            throw new UpstreamMalformedResponseException(connectorType + ": failed to decode response", e);
        }
    }

    private OAuth2Token parseTokenResponse(HttpResponse<Buffer> response) {
        final int status = response.statusCode();
        if (status != 200) {
            final var error = errorField(response);
            if (status >= 400 && status < 500 && error != null) {
                LOG.warnf("%s: token request rejected with %s", connectorType, error.getString("error"));
                throw new UpstreamRejectedException(error.getString("error"), error.getString("error_description"));
            }
            LOG.warnf("%s: token request failed with status %d", connectorType, status);
            throw new UpstreamMalformedResponseException(
                    "%s: token endpoint returned status %d".formatted(connectorType, status), status);
        }

        final var json = jsonObject(response);
        final var accessToken = json.getString("access_token");
        if (accessToken == null || accessToken.isBlank()) {
            throw new UpstreamMalformedResponseException(connectorType + ": token response missing access_token", 200);
        }

        return new OAuth2Token(
                accessToken,
                json.getString("refresh_token"),
                json.getString("id_token"),
                json.getString("token_type", "Bearer"),
                json.getLong("expires_in", DEFAULT_EXPIRES_IN_SECONDS));
    }

    private static JsonObject errorField(HttpResponse<Buffer> response) {
        try {
            final var json = response.bodyAsJsonObject();
            return json != null && json.getValue("error") instanceof String ? json : null;
        } catch (RuntimeException e) {
            LOG.debugv("Error response is not JSON: {0}", e.getMessage());
            return null;
        }
    }

    private <T> Uni<T> transport(Uni<T> call, String what) {
        return call.onFailure(error -> !(error instanceof BrokerException)).transform(error -> {
            LOG.warnf("%s: %s failed: %s", connectorType, what, error.getMessage());
            return new UpstreamUnreachableException(connectorType + ": " + what + " failed", error);
        });
    }
}
