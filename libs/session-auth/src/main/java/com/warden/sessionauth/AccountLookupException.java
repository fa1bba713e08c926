package com.warden.sessionauth;

import java.io.Serializable;

/**
 * Thrown by {@link Account#getById(Serializable)} when a session-held identifier cannot be
 * resolved to an account (deleted principal, stale reference, corrupt value).
 * <p>
 * {@link AccountResolver} recovers from it by treating the request as anonymous.
 */
public class AccountLookupException extends Exception {

    private final Serializable accountId;

    public AccountLookupException(Serializable accountId, String message) {
        super(message);
        this.accountId = accountId;
    }

    public AccountLookupException(Serializable accountId, String message, Throwable cause) {
        super(message, cause);
        this.accountId = accountId;
    }

    /**
     * Creates the exception for an id that no longer maps to any account.
     */
    public static AccountLookupException notFound(Serializable accountId) {
        return new AccountLookupException(accountId, "No account found for id '%s'".formatted(accountId));
    }

    public Serializable accountId() {
        return accountId;
    }
}
