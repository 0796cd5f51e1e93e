package warden.core.util;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Random identifiers for stored entities.
 */
public final class Identifiers {

    private static final SecureRandom RANDOM = new SecureRandom();

    // Lower-case RFC 4648 alphabet; ids must stay valid in case-insensitive stores.
    private static final char[] BASE32 = "abcdefghijklmnopqrstuvwxyz234567".toCharArray();

    // No vowels, so codes never spell words, and no lookalike characters.
    private static final char[] USER_CODE_ALPHABET = "BCDFGHJKLMNPQRSTVWXZ".toCharArray();

    private Identifiers() {}

    /**
     * A new entity id: 16 random bytes in unpadded lower-case base32.
     */
    public static String newId() {
        final var bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return base32(bytes);
    }

    /**
     * A device flow user code in the form {@code XXXX-XXXX}.
     */
    public static String newUserCode() {
        final var code = new StringBuilder(9);
        for (int i = 0; i < 8; i++) {
            if (i == 4) {
                code.append('-');
            }
            code.append(USER_CODE_ALPHABET[RANDOM.nextInt(USER_CODE_ALPHABET.length)]);
        }
        return code.toString();
    }

    /**
     * A URL-safe random secret carrying {@code bytes} bytes of entropy.
     */
    public static String newSecret(int bytes) {
        final var buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer);
    }

    static String base32(byte[] data) {
        final var out = new StringBuilder((data.length * 8 + 4) / 5);
        int buffer = 0;
        int bits = 0;
        for (byte b : data) {
            buffer = (buffer << 8) | (b & 0xff);
            bits += 8;
            while (bits >= 5) {
                out.append(BASE32[(buffer >> (bits - 5)) & 0x1f]);
                bits -= 5;
            }
        }
        if (bits > 0) {
            out.append(BASE32[(buffer << (5 - bits)) & 0x1f]);
        }
        return out.toString();
    }
}
