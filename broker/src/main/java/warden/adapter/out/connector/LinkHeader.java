package warden.adapter.out.connector;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses RFC 8288 {@code Link} headers as used for REST API pagination.
 */
public final class LinkHeader {

    private static final Pattern NEXT = Pattern.compile("<([^>]+)>;\\s*rel=\"next\"");
    private static final Pattern LAST = Pattern.compile("<([^>]+)>;\\s*rel=\"last\"");

    private LinkHeader() {}

    public static Optional<String> next(String header) {
        return find(NEXT, header);
    }

    public static Optional<String> last(String header) {
        return find(LAST, header);
    }

    private static Optional<String> find(Pattern pattern, String header) {
        if (header == null || header.isEmpty()) {
            return Optional.empty();
        }
        final var matcher = pattern.matcher(header);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
