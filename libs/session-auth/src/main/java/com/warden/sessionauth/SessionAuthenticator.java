package com.warden.sessionauth;

import java.io.Serializable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Links accounts to sessions and unlinks them again.
 * <p>
 * Invoked imperatively by application code: {@link #authenticate} after credentials were verified
 * elsewhere, {@link #logout} on sign-out, {@link #update} whenever account state that affects
 * identity changes.
 */
public final class SessionAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticator.class);

    private final SessionAuthSettings settings;

    public SessionAuthenticator(SessionAuthSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.settings = settings;
    }

    /**
     * Marks a validated account as logged in and stores its id in the session.
     *
     * @throws SessionStoreException if the session cannot be written
     */
    public void authenticate(SessionStore session, Account<?> account) {
        log.debug("Authenticating account {}", account.uniqueId());
        account.login();
        update(session, account);
    }

    /**
     * Clears the account's authenticated state and removes its id from the session.
     */
    public void logout(SessionStore session, Account<?> account) {
        log.debug("Logging out account {}", account.uniqueId());
        account.logout();
        session.delete(settings.sessionKey());
    }

    /**
     * Stores the account's id under the session key, replacing any previous value. Idempotent.
     *
     * @throws IllegalArgumentException if the account has no unique id
     * @throws SessionStoreException    if the session cannot be written
     */
    public void update(SessionStore session, Account<?> account) {
        Serializable accountId = account.uniqueId();
        if (accountId == null) {
            throw new IllegalArgumentException("cannot store an account without a unique id in the session");
        }
        session.set(settings.sessionKey(), accountId);
        log.debug("Stored account id {} under session key '{}'", accountId, settings.sessionKey());
    }
}
