package com.warden.sessionauth;

import java.io.Serializable;
import java.util.Optional;

/**
 * Key/value view of the session attached to one request.
 * <p>
 * Storage, cookie handling and locking belong to the implementation. Every operation is treated
 * as atomic by this library; failures surface as {@link SessionStoreException}.
 */
public interface SessionStore {

    /**
     * Returns the value stored under {@code key}, or empty if there is none.
     */
    Optional<Serializable> get(String key);

    /**
     * Stores {@code value} under {@code key}, replacing any previous value.
     */
    void set(String key, Serializable value);

    /**
     * Removes {@code key}. Removing an absent key is a no-op.
     */
    void delete(String key);
}
