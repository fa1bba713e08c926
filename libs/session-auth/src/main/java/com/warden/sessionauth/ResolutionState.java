package com.warden.sessionauth;

/**
 * Authentication state of a single request.
 * <p>
 * {@code UNRESOLVED} until {@link AccountResolver} binds an account, then {@code ANONYMOUS} or
 * {@code AUTHENTICATED} for the rest of the request.
 */
public enum ResolutionState {
    UNRESOLVED,
    ANONYMOUS,
    AUTHENTICATED
}
