package com.warden.sessionauth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a request may reach its handler.
 * <p>
 * Consumes the account already bound by {@link AccountResolver} and the request path. An
 * unsatisfied requirement yields a redirect to the requirement's login page with the requested
 * path in the {@link SessionAuthSettings#redirectParam()} query parameter. A satisfied
 * requirement has no side effects.
 */
public final class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final SessionAuthSettings settings;

    public AccessGuard(SessionAuthSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.settings = settings;
    }

    public GuardDecision check(AccessRequirement requirement, Account<?> account, String requestPath) {
        if (requirement.isSatisfiedBy(account)) {
            return GuardDecision.pass();
        }
        String target = RedirectTargets.build(
                requirement.loginUrl(settings), settings.redirectParam(), requestPath, settings.encodeRedirectPath());
        log.debug("{} requirement not met by account {} for '{}'; redirecting to {}",
                requirement, account.uniqueId(), requestPath, target);
        return GuardDecision.redirect(target);
    }

    /** Fails unless the account is authenticated. */
    public GuardDecision requireLogin(Account<?> account, String requestPath) {
        return check(AccessRequirement.LOGIN, account, requestPath);
    }

    /** Fails unless the account is authenticated and an administrator. */
    public GuardDecision requireAdmin(Account<?> account, String requestPath) {
        return check(AccessRequirement.ADMIN, account, requestPath);
    }
}
