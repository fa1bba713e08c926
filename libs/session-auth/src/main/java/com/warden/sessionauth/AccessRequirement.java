package com.warden.sessionauth;

/**
 * What a guarded route demands of the bound account.
 */
public enum AccessRequirement {

    /** The account must be authenticated. */
    LOGIN {
        @Override
        public boolean isSatisfiedBy(Account<?> account) {
            return account.isAuthenticated();
        }

        @Override
        public String loginUrl(SessionAuthSettings settings) {
            return settings.redirectUrl();
        }
    },

    /** The account must be authenticated and hold administrator privilege. */
    ADMIN {
        @Override
        public boolean isSatisfiedBy(Account<?> account) {
            return account.isAuthenticated() && account.isAdmin();
        }

        @Override
        public String loginUrl(SessionAuthSettings settings) {
            return settings.adminRedirectUrl();
        }
    };

    public abstract boolean isSatisfiedBy(Account<?> account);

    /**
     * Login page an unsatisfied request is sent to.
     */
    public abstract String loginUrl(SessionAuthSettings settings);
}
