package com.warden.sessionauth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds {@code {loginUrl}?{param}={path}} redirect targets.
 */
public final class RedirectTargets {

    private RedirectTargets() {
        // utility class
    }

    /**
     * Appends the originally requested path to a login URL as a query parameter.
     * <p>
     * With {@code encode} set, the path is percent-encoded as a query value while {@code /} is
     * kept readable, so {@code /some/path} stays {@code /some/path} but {@code &}, {@code =} and
     * spaces cannot corrupt the query string. Without it the path is interpolated verbatim.
     * A login URL that already carries a query string is extended with {@code &}.
     *
     * @param loginUrl login page URL
     * @param param    query parameter name
     * @param path     originally requested path (null is treated as empty)
     * @param encode   whether to percent-encode the path
     * @return the redirect target
     */
    public static String build(String loginUrl, String param, String path, boolean encode) {
        String value = path == null ? "" : path;
        if (encode) {
            value = encodeQueryValue(value);
        }
        char separator = loginUrl.indexOf('?') >= 0 ? '&' : '?';
        return loginUrl + separator + param + "=" + value;
    }

    static String encodeQueryValue(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%2F", "/");
    }
}
