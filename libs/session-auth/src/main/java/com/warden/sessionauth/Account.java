package com.warden.sessionauth;

import java.io.Serializable;

/**
 * Capability set every principal type must offer to take part in session authentication.
 * <p>
 * Implementations are supplied by the embedding application; this library ships none outside
 * {@code com.warden.sessionauth.testing}. The self-referencing type parameter lets
 * {@link #getById(Serializable)} hand back the application's concrete type, so downstream
 * handlers never need to cast.
 * <p>
 * One instance belongs to exactly one request. Instances are never shared across requests and
 * are never mutated concurrently.
 *
 * @param <A> the concrete account type
 */
public interface Account<A extends Account<A>> {

    /**
     * Returns whether this account is logged in for the current request.
     */
    boolean isAuthenticated();

    /**
     * Returns whether this account holds elevated (administrator) privilege.
     */
    boolean isAdmin();

    /**
     * Sets the authenticated flag and any derived state. Must not change {@link #uniqueId()}.
     */
    void login();

    /**
     * Clears the authenticated flag and any sensitive derived state. Must not change
     * {@link #uniqueId()}.
     */
    void logout();

    /**
     * Returns the opaque identifier stored in the session for this principal.
     * <p>
     * The value must be stable for the principal's lifetime and must implement
     * {@code equals} so that it can be compared with the value read back from the session.
     *
     * @return the identifier, or {@code null} for the anonymous zero-value account
     */
    Serializable uniqueId();

    /**
     * Loads the account identified by {@code id}.
     * <p>
     * Called on a fresh zero-value instance; the returned account is fully populated but not yet
     * logged in.
     *
     * @param id the identifier previously stored in the session
     * @return the populated account
     * @throws AccountLookupException if the id is unknown, stale or cannot be resolved
     */
    A getById(Serializable id) throws AccountLookupException;
}
