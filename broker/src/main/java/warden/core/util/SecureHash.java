package warden.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Utility for deterministic hashing of identifiers.
 *
 * <p>Used to derive single-column storage keys from composite keys, where the original
 * value must be reproducible but not necessarily readable.
 */
public final class SecureHash {

    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private SecureHash() {}

    /**
     * Return the full SHA-256 hex digest of the input string.
     */
    public static String sha256Hex(String input) {
        return hex(DEFAULT_ALGORITHM, input);
    }

    /**
     * Return the hex digest of the input string using the named {@link MessageDigest} algorithm.
     *
     * @throws IllegalArgumentException if the algorithm is not available
     */
    public static String hex(String algorithm, String input) {
        try {
            final var digest = MessageDigest.getInstance(algorithm);
            final var hashBytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm, e);
        }
    }

    /**
     * Check the algorithm exists, so misconfiguration fails at startup rather than on first use.
     */
    public static void requireAlgorithm(String algorithm) {
        hex(algorithm, "");
    }
}
