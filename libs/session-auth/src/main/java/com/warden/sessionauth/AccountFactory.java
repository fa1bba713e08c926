package com.warden.sessionauth;

/**
 * Supplies a fresh zero-value (anonymous) account for every request.
 *
 * @param <A> the concrete account type
 */
@FunctionalInterface
public interface AccountFactory<A extends Account<A>> {

    /**
     * Creates a new, unauthenticated account instance. Must never return {@code null} and must
     * never return an instance that is shared with another request.
     */
    A newAccount();
}
