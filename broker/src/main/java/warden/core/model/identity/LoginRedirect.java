package warden.core.model.identity;

import java.util.Objects;

/**
 * Where to send the user to log in upstream.
 *
 * @param url          the upstream authorization request URL
 * @param continuation opaque state the connector wants back in {@code handleCallback}, may be null
 */
public record LoginRedirect(String url, byte[] continuation) {

    public LoginRedirect {
        Objects.requireNonNull(url, "url is required");
    }

    public static LoginRedirect to(String url) {
        return new LoginRedirect(url, null);
    }
}
