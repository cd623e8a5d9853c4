package io.privx.sdk.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds resource paths with percent-escaped identifier segments.
 */
public final class RestPaths {

    private RestPaths() {
    }

    /**
     * Formats {@code template} with every argument escaped as a single path segment.
     *
     * <pre>{@code
     * RestPaths.format("/role-store/api/v1/users/%s/roles", "a b/c")
     * // "/role-store/api/v1/users/a%20b%2Fc/roles"
     * }</pre>
     */
    public static String format(String template, String... segments) {
        Object[] escaped = new Object[segments.length];
        for (int i = 0; i < segments.length; i++) {
            escaped[i] = escapeSegment(segments[i]);
        }
        return String.format(template, escaped);
    }

    public static String escapeSegment(String segment) {
        // URLEncoder is form encoding; undo the two places it differs from path escaping
        return URLEncoder.encode(segment, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("%7E", "~");
    }
}
