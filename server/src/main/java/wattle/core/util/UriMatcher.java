package wattle.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Compares URIs the way issuer and audience identifiers are compared: scheme and host
 * ignore case, ports must match after resolving the scheme's default port, paths are
 * compared exactly.
 */
public final class UriMatcher {

    private UriMatcher() {}

    /**
     * Compares two absolute URIs.
     *
     * @param candidate           value taken from a token, may be null or malformed
     * @param expected            the URI the value must designate
     * @param ignoreTrailingSlash treat {@code /path} and {@code /path/} as equal
     * @return true if both designate the same resource; false when the candidate is not
     *         an absolute URI
     */
    public static boolean matches(String candidate, URI expected, boolean ignoreTrailingSlash) {
        if (candidate == null || expected == null) {
            return false;
        }
        final URI actual;
        try {
            actual = new URI(candidate);
        } catch (URISyntaxException e) {
            return false;
        }
        if (!actual.isAbsolute() || actual.getHost() == null || expected.getHost() == null) {
            return false;
        }

        return actual.getScheme().equalsIgnoreCase(expected.getScheme())
                && actual.getHost().equalsIgnoreCase(expected.getHost())
                && effectivePort(actual) == effectivePort(expected)
                && normalizePath(actual.getPath(), ignoreTrailingSlash)
                        .equals(normalizePath(expected.getPath(), ignoreTrailingSlash));
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return switch (uri.getScheme().toLowerCase(Locale.ROOT)) {
            case "http" -> 80;
            case "https" -> 443;
            default -> -1;
        };
    }

    private static String normalizePath(String path, boolean ignoreTrailingSlash) {
        final var value = path == null ? "" : path;
        if (!ignoreTrailingSlash) {
            return value;
        }
        var end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
