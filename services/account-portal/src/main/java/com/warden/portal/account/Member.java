package com.warden.portal.account;

import com.warden.sessionauth.Account;
import com.warden.sessionauth.AccountLookupException;
import java.io.Serializable;

/**
 * Portal principal. The username is the id kept in the session.
 * <p>
 * A zero-value member (no username) stands for the anonymous visitor.
 */
public final class Member implements Account<Member> {

    private final MemberDirectory directory;
    private final String username;
    private final String displayName;
    private final boolean admin;
    private boolean authenticated;

    Member(MemberDirectory directory, String username, String displayName, boolean admin) {
        this.directory = directory;
        this.username = username;
        this.displayName = displayName;
        this.admin = admin;
    }

    @Override
    public boolean isAuthenticated() {
        return authenticated;
    }

    @Override
    public boolean isAdmin() {
        return admin;
    }

    @Override
    public void login() {
        authenticated = true;
    }

    @Override
    public void logout() {
        authenticated = false;
    }

    @Override
    public Serializable uniqueId() {
        return username;
    }

    @Override
    public Member getById(Serializable id) throws AccountLookupException {
        if (!(id instanceof String name)) {
            throw new AccountLookupException(id, "Member ids are usernames, got " + id.getClass().getName());
        }
        return directory.find(name).orElseThrow(() -> AccountLookupException.notFound(id));
    }

    public String username() {
        return username;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isAnonymous() {
        return username == null;
    }

    @Override
    public String toString() {
        return "Member[username=" + username + ", authenticated=" + authenticated + ", admin=" + admin + "]";
    }
}
