package warden.adapter.out.connector.google;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON configuration of a Google connector.
 *
 * <p>Endpoint fields default to Google's production endpoints and are only overridden in tests
 * or behind a proxy.
 *
 * @param hostedDomains      Workspace domains allowed to log in; empty allows any account
 * @param groups             allow-list; only effective when a directory binding is configured
 * @param domainToAdminEmail Workspace domain to super-admin email impersonated for directory lookups,
 *                           {@code *} matches any domain
 * @param adminEmail         deprecated alias of the {@code *} binding
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleConnectorConfig(
        @JsonProperty("clientID") String clientId,
        @JsonProperty("clientSecret") String clientSecret,
        @JsonProperty("redirectURI") String redirectUri,
        @JsonProperty("scopes") List<String> scopes,
        @JsonProperty("hostedDomains") List<String> hostedDomains,
        @JsonProperty("groups") List<String> groups,
        @JsonProperty("serviceAccountFilePath") String serviceAccountFilePath,
        @JsonProperty("domainToAdminEmail") Map<String, String> domainToAdminEmail,
        @JsonProperty("adminEmail") String adminEmail,
        @JsonProperty("fetchTransitiveGroupMembership") boolean fetchTransitiveGroupMembership,
        @JsonProperty("issuer") String issuer,
        @JsonProperty("authURL") String authUrl,
        @JsonProperty("tokenURL") String tokenUrl,
        @JsonProperty("jwksURI") String jwksUri,
        @JsonProperty("directoryURL") String directoryUrl,
        @JsonProperty("timeout") String timeout) {

    static final String WILDCARD_DOMAIN = "*";
    static final String DEFAULT_ISSUER = "https://accounts.google.com";

    public GoogleConnectorConfig {
        redirectUri = redirectUri != null ? redirectUri : "";
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
        hostedDomains = hostedDomains != null ? List.copyOf(hostedDomains) : List.of();
        groups = groups != null ? List.copyOf(groups) : List.of();
        domainToAdminEmail = domainToAdminEmail != null ? Map.copyOf(domainToAdminEmail) : Map.of();
        issuer = orDefault(issuer, DEFAULT_ISSUER);
        authUrl = orDefault(authUrl, "https://accounts.google.com/o/oauth2/v2/auth");
        tokenUrl = orDefault(tokenUrl, "https://oauth2.googleapis.com/token");
        jwksUri = orDefault(jwksUri, "https://www.googleapis.com/oauth2/v3/certs");
        directoryUrl = orDefault(directoryUrl, "https://admin.googleapis.com");
        timeout = orDefault(timeout, "PT10S");
    }

    /**
     * Scopes sent to Google: {@code openid} first, then the configured scopes or
     * {@code profile email}.
     */
    public List<String> requestScopes() {
        final var result = new ArrayList<String>();
        result.add("openid");
        for (String scope : scopes.isEmpty() ? List.of("profile", "email") : scopes) {
            if (!result.contains(scope)) {
                result.add(scope);
            }
        }
        return result;
    }

    /**
     * Directory bindings with the deprecated {@code adminEmail} folded in as the wildcard.
     */
    public Map<String, String> adminBindings() {
        final var bindings = new LinkedHashMap<>(domainToAdminEmail);
        if (adminEmail != null && !adminEmail.isEmpty()) {
            bindings.put(WILDCARD_DOMAIN, adminEmail);
        }
        return bindings;
    }

    public Duration requestTimeout() {
        return Duration.parse(timeout);
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isEmpty() ? defaultValue : value;
    }
}
