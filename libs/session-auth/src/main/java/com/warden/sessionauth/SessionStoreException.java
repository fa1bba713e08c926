package com.warden.sessionauth;

/**
 * Thrown when the underlying session store cannot complete an operation.
 * <p>
 * Unchecked: this library never handles it. It propagates to whatever the embedding pipeline does
 * with unhandled errors and fails the request, not the process.
 */
public class SessionStoreException extends RuntimeException {

    public SessionStoreException(String message) {
        super(message);
    }

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
