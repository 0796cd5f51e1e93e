package warden.core.model.storage;

import java.util.Locale;
import java.util.Objects;

/**
 * A local password entry, keyed by the lower-cased email address.
 *
 * @param hash bcrypt hash of the password
 */
public record Password(String email, byte[] hash, String username, String userId) {

    public Password {
        Objects.requireNonNull(email, "email is required");
        email = email.toLowerCase(Locale.ROOT);
    }
}
