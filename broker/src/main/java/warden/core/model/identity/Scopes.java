package warden.core.model.identity;

import java.util.Collection;

/**
 * Scopes requested by the relying party that influence what a connector fetches upstream.
 *
 * @param offlineAccess the client asked for a refresh token, so connector data must be kept
 * @param groups        the client asked for group claims
 */
public record Scopes(boolean offlineAccess, boolean groups) {

    public static final String OFFLINE_ACCESS = "offline_access";
    public static final String GROUPS = "groups";

    public static final Scopes NONE = new Scopes(false, false);

    /**
     * Derive the connector-relevant flags from the raw OAuth2 scope values.
     */
    public static Scopes of(Collection<String> requested) {
        return new Scopes(requested.contains(OFFLINE_ACCESS), requested.contains(GROUPS));
    }
}
