package com.warden.sessionauth;

import java.util.Optional;

/**
 * Per-request slot carrying the resolved account.
 * <p>
 * Written exactly once by {@link AccountResolver}, then read by guards and handlers for the rest
 * of the request. Not thread-safe: a context belongs to one request and one thread of control.
 *
 * @param <A> the concrete account type
 */
public final class AccountContext<A extends Account<A>> {

    private A account;
    private ResolutionState state = ResolutionState.UNRESOLVED;

    /**
     * Binds the resolved account to this request.
     *
     * @param account the account to publish (must not be null)
     * @throws IllegalArgumentException if account is null
     * @throws IllegalStateException    if an account is already bound
     */
    public void bind(A account) {
        if (account == null) {
            throw new IllegalArgumentException("account must not be null");
        }
        if (state != ResolutionState.UNRESOLVED) {
            throw new IllegalStateException("an account is already bound to this request (state " + state + ")");
        }
        this.account = account;
        this.state = account.isAuthenticated() ? ResolutionState.AUTHENTICATED : ResolutionState.ANONYMOUS;
    }

    public Optional<A> account() {
        return Optional.ofNullable(account);
    }

    /**
     * Returns the bound account.
     *
     * @throws IllegalStateException if the resolver has not run for this request
     */
    public A requireAccount() {
        if (account == null) {
            throw new IllegalStateException("no account has been resolved for this request");
        }
        return account;
    }

    /**
     * State recorded at bind time. Later calls to {@link Account#login()} or
     * {@link Account#logout()} on the bound account do not change it.
     */
    public ResolutionState state() {
        return state;
    }

    public boolean isResolved() {
        return state != ResolutionState.UNRESOLVED;
    }
}
