package com.warden.sessionauth;

/**
 * Immutable settings shared by the resolver, the authenticator and the guards.
 * <p>
 * Built once at setup time and passed to constructors; nothing in this library reads mutable
 * globals. Null or blank strings fall back to the defaults below.
 *
 * @param redirectUrl        login page for {@link AccessRequirement#LOGIN}
 * @param adminRedirectUrl   login page for {@link AccessRequirement#ADMIN}
 * @param redirectParam      query parameter carrying the originally requested path
 * @param sessionKey         session key holding the authenticated account's unique id
 * @param encodeRedirectPath percent-encode the requested path inside the redirect query string
 * @param evictStaleIdentity delete the session key when its id can no longer be resolved
 */
public record SessionAuthSettings(
        String redirectUrl,
        String adminRedirectUrl,
        String redirectParam,
        String sessionKey,
        boolean encodeRedirectPath,
        boolean evictStaleIdentity
) {

    public static final String DEFAULT_REDIRECT_URL = "/account/login";
    public static final String DEFAULT_ADMIN_REDIRECT_URL = "/admin/account/login";
    public static final String DEFAULT_REDIRECT_PARAM = "next";
    public static final String DEFAULT_SESSION_KEY = "AUTH_UNIQUE_ID";

    public SessionAuthSettings {
        redirectUrl = orDefault(redirectUrl, DEFAULT_REDIRECT_URL);
        adminRedirectUrl = orDefault(adminRedirectUrl, DEFAULT_ADMIN_REDIRECT_URL);
        redirectParam = orDefault(redirectParam, DEFAULT_REDIRECT_PARAM);
        sessionKey = orDefault(sessionKey, DEFAULT_SESSION_KEY);
    }

    /**
     * Returns the default settings: standard URLs, {@code next} parameter,
     * {@code AUTH_UNIQUE_ID} key, encoded redirect paths, stale ids left in place.
     */
    public static SessionAuthSettings defaults() {
        return new SessionAuthSettings(null, null, null, null, true, false);
    }

    public SessionAuthSettings withSessionKey(String key) {
        return new SessionAuthSettings(
                redirectUrl, adminRedirectUrl, redirectParam, key, encodeRedirectPath, evictStaleIdentity);
    }

    public SessionAuthSettings withEncodeRedirectPath(boolean encode) {
        return new SessionAuthSettings(
                redirectUrl, adminRedirectUrl, redirectParam, sessionKey, encode, evictStaleIdentity);
    }

    public SessionAuthSettings withEvictStaleIdentity(boolean evict) {
        return new SessionAuthSettings(
                redirectUrl, adminRedirectUrl, redirectParam, sessionKey, encodeRedirectPath, evict);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.strip();
    }
}
