package com.warden.portal.account;

/**
 * Thrown by the login endpoint when the username/password pair does not match a member.
 */
public class InvalidCredentialsException extends RuntimeException {

    private final String username;

    public InvalidCredentialsException(String username) {
        super("Invalid username or password");
        this.username = username;
    }

    public String username() {
        return username;
    }
}
