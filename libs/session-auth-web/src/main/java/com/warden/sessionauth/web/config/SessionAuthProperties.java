package com.warden.sessionauth.web.config;

import com.warden.sessionauth.SessionAuthSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for session authentication, bound from {@code warden.session-auth.*}.
 *
 * <pre>
 * warden:
 *   session-auth:
 *     redirect-url: /account/login
 *     admin-redirect-url: /admin/account/login
 *     redirect-param: next
 *     session-key: AUTH_UNIQUE_ID
 *     encode-redirect-path: true
 *     evict-stale-identity: false
 *     login-required-paths: [/dashboard/**]
 *     admin-required-paths: [/admin/**]
 * </pre>
 *
 * <p>The compact constructor applies defaults before Bean Validation runs, so omitted values
 * always validate.
 *
 * @param redirectUrl login page for routes that need an authenticated account
 * @param adminRedirectUrl login page for routes that need an administrator
 * @param redirectParam query parameter carrying the originally requested path
 * @param sessionKey session attribute holding the authenticated account's id
 * @param encodeRedirectPath percent-encode the requested path in redirects (default true)
 * @param evictStaleIdentity delete session ids that no longer resolve (default false)
 * @param loginRequiredPaths path patterns guarded as if annotated {@code @LoginRequired}
 * @param adminRequiredPaths path patterns guarded as if annotated {@code @AdminRequired}
 */
@Validated
@ConfigurationProperties(prefix = "warden.session-auth")
public record SessionAuthProperties(
        @NotBlank String redirectUrl,
        @NotBlank String adminRedirectUrl,
        @NotBlank @Pattern(regexp = "[^&=?#\\s]+", message = "must not contain '&', '=', '?', '#' or whitespace")
                String redirectParam,
        @NotBlank String sessionKey,
        Boolean encodeRedirectPath,
        boolean evictStaleIdentity,
        List<String> loginRequiredPaths,
        List<String> adminRequiredPaths) {

    public SessionAuthProperties {
        SessionAuthSettings defaults = SessionAuthSettings.defaults();
        if (redirectUrl == null || redirectUrl.isBlank()) {
            redirectUrl = defaults.redirectUrl();
        }
        if (adminRedirectUrl == null || adminRedirectUrl.isBlank()) {
            adminRedirectUrl = defaults.adminRedirectUrl();
        }
        if (redirectParam == null || redirectParam.isBlank()) {
            redirectParam = defaults.redirectParam();
        }
        if (sessionKey == null || sessionKey.isBlank()) {
            sessionKey = defaults.sessionKey();
        }
        if (encodeRedirectPath == null) {
            encodeRedirectPath = defaults.encodeRedirectPath();
        }
        loginRequiredPaths = loginRequiredPaths == null ? List.of() : List.copyOf(loginRequiredPaths);
        adminRequiredPaths = adminRequiredPaths == null ? List.of() : List.copyOf(adminRequiredPaths);
    }

    /**
     * Converts to the framework-neutral settings used by the core components.
     */
    public SessionAuthSettings toSettings() {
        return new SessionAuthSettings(
                redirectUrl, adminRedirectUrl, redirectParam, sessionKey, encodeRedirectPath, evictStaleIdentity);
    }
}
