package com.warden.sessionauth.web;

import com.warden.sessionauth.Account;
import com.warden.sessionauth.AccountContext;
import jakarta.servlet.ServletRequest;
import java.util.Optional;

/**
 * Lookup of the {@link AccountContext} that {@link AccountResolutionFilter} published on a
 * request.
 * <p>
 * The context travels as a request attribute, so it follows the request through forwards and
 * error dispatches and never leaks into another request.
 */
public final class RequestAccounts {

    /** Request attribute holding the {@link AccountContext}. */
    public static final String CONTEXT_ATTRIBUTE = RequestAccounts.class.getName() + ".CONTEXT";

    private RequestAccounts() {
        // utility class
    }

    /**
     * Publishes {@code context} on the request.
     *
     * @throws IllegalStateException if a context is already published
     */
    public static void publish(ServletRequest request, AccountContext<?> context) {
        if (request.getAttribute(CONTEXT_ATTRIBUTE) != null) {
            throw new IllegalStateException("an account context is already published on this request");
        }
        request.setAttribute(CONTEXT_ATTRIBUTE, context);
    }

    /**
     * Returns the published context, if the resolution filter ran for this request.
     */
    public static Optional<AccountContext<?>> context(ServletRequest request) {
        Object attribute = request.getAttribute(CONTEXT_ATTRIBUTE);
        if (attribute instanceof AccountContext<?> context) {
            return Optional.of(context);
        }
        return Optional.empty();
    }

    /**
     * Returns the account bound to this request.
     *
     * @throws IllegalStateException if no account was resolved, which means
     *                               {@link AccountResolutionFilter} is not installed in front of
     *                               the caller
     */
    public static Account<?> requireAccount(ServletRequest request) {
        return context(request)
                .filter(AccountContext::isResolved)
                .<Account<?>>map(AccountContext::requireAccount)
                .orElseThrow(() -> new IllegalStateException(
                        "no account resolved for this request; is AccountResolutionFilter registered?"));
    }

    /**
     * Returns the account bound to this request as the application's concrete type.
     *
     * @throws IllegalStateException if no account was resolved or it is not a {@code type}
     */
    public static <A extends Account<A>> A requireAccount(ServletRequest request, Class<A> type) {
        Account<?> account = requireAccount(request);
        if (!type.isInstance(account)) {
            throw new IllegalStateException("bound account is a " + account.getClass().getName()
                    + ", not a " + type.getName());
        }
        return type.cast(account);
    }
}
