package com.warden.sessionauth;

import java.io.Serializable;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts session state into the account bound to the current request.
 * <p>
 * Runs once per request, early in the pipeline:
 * <ol>
 *   <li>no id under the session key: bind a fresh zero-value account (anonymous)</li>
 *   <li>id present and {@link Account#getById(Serializable)} succeeds: call
 *       {@link Account#login()} on the loaded account and bind it</li>
 *   <li>id present but the lookup fails: log a warning and bind the zero-value account, so the
 *       request proceeds anonymously instead of failing</li>
 * </ol>
 * The session is only read, unless {@link SessionAuthSettings#evictStaleIdentity()} is set, in
 * which case an unresolvable id is deleted so later requests stop retrying it.
 *
 * @param <A> the concrete account type
 */
public final class AccountResolver<A extends Account<A>> {

    private static final Logger log = LoggerFactory.getLogger(AccountResolver.class);

    private final AccountFactory<A> accountFactory;
    private final SessionAuthSettings settings;

    public AccountResolver(AccountFactory<A> accountFactory, SessionAuthSettings settings) {
        if (accountFactory == null) {
            throw new IllegalArgumentException("accountFactory must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.accountFactory = accountFactory;
        this.settings = settings;
    }

    /**
     * Resolves the account for this request and binds it to {@code context}.
     *
     * @param session the current request's session
     * @param context the request's context, still unresolved
     * @return the bound account
     * @throws SessionStoreException if the session cannot be read
     * @throws IllegalStateException if the context already holds an account
     */
    public A resolve(SessionStore session, AccountContext<A> context) {
        A anonymous = newAnonymousAccount();
        Optional<Serializable> accountId = session.get(settings.sessionKey());
        log.debug("Session key '{}' holds account id {}", settings.sessionKey(), accountId.orElse(null));

        A account = anonymous;
        if (accountId.isPresent()) {
            account = load(anonymous, accountId.get(), session);
        }

        context.bind(account);
        return account;
    }

    private A load(A anonymous, Serializable accountId, SessionStore session) {
        try {
            A loaded = anonymous.getById(accountId);
            if (loaded == null) {
                throw AccountLookupException.notFound(accountId);
            }
            loaded.login();
            log.debug("Resolved authenticated account {}", accountId);
            return loaded;
        } catch (AccountLookupException e) {
            log.warn("Login error: account lookup failed for session id {}: {}", e.accountId(), e.getMessage());
            if (settings.evictStaleIdentity()) {
                session.delete(settings.sessionKey());
                log.info("Evicted stale account id {} from session key '{}'", accountId, settings.sessionKey());
            }
            return anonymous;
        }
    }

    private A newAnonymousAccount() {
        A account = accountFactory.newAccount();
        if (account == null) {
            throw new IllegalStateException("AccountFactory returned null; it must supply a zero-value account");
        }
        return account;
    }
}
