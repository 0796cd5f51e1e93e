package warden.spi;

import io.smallrye.mutiny.Uni;

import warden.core.model.identity.CallbackRequest;
import warden.core.model.identity.Identity;
import warden.core.model.identity.LoginRedirect;
import warden.core.model.identity.Scopes;

/**
 * A pluggable integration with one upstream identity provider.
 *
 * <p>Instances are configured once when opened and are safe for concurrent use by any
 * number of login flows: all per-flow state travels through arguments and return values.
 *
 * <h2>Cancellation</h2>
 * <p>Cancelling the {@link Uni} returned by {@link #handleCallback} or {@link #refresh}
 * aborts the in-flight upstream request. Callers impose deadlines with
 * {@code ifNoItem().after(...)}; connectors additionally bound each request by their
 * configured timeout. Connectors never retry.
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link warden.core.exception.UpstreamRejectedException} - the provider declined</li>
 *   <li>{@link warden.core.exception.UpstreamUnreachableException} - transport failure</li>
 *   <li>{@link warden.core.exception.UpstreamMalformedResponseException} - bad status or body</li>
 *   <li>{@link warden.core.exception.GroupPolicyViolationException} - not in an allowed group</li>
 *   <li>{@link warden.core.exception.ConfigurationException} - redirect mismatch, bad connector data</li>
 * </ul>
 */
public interface Connector {

    /**
     * Build the upstream authorization request URL.
     *
     * @param scopes      scopes requested by the client
     * @param callbackUrl must equal the configured redirect URI exactly
     * @param state       CSRF and session correlation token, passed through upstream
     * @return where to redirect the user
     * @throws warden.core.exception.ConfigurationException if {@code callbackUrl} does not match
     */
    LoginRedirect loginUrl(Scopes scopes, String callbackUrl, String state);

    /**
     * Turn the upstream redirect into an identity.
     *
     * @param scopes       scopes requested by the client
     * @param continuation the opaque value returned with the login redirect, may be null
     * @param request      the callback query parameters
     * @return the authenticated identity
     */
    Uni<Identity> handleCallback(Scopes scopes, byte[] continuation, CallbackRequest request);

    /**
     * Re-derive an identity from the connector data of a previous one, without user interaction.
     *
     * @param scopes   scopes of the refresh token being redeemed
     * @param identity identity previously produced by this connector
     * @return a fresh identity
     */
    Uni<Identity> refresh(Scopes scopes, Identity identity);
}
