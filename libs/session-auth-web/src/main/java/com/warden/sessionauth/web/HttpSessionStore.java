package com.warden.sessionauth.web;

import com.warden.sessionauth.SessionStore;
import com.warden.sessionauth.SessionStoreException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import java.io.Serializable;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionStore} backed by the servlet container's {@link HttpSession}.
 * <p>
 * Reads and deletes never create a session, so anonymous traffic does not allocate one. Only
 * {@link #set(String, Serializable)} does. Cookie handling, replication and persistence stay with
 * the container (or Spring Session, when installed).
 */
public final class HttpSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(HttpSessionStore.class);

    private final HttpServletRequest request;

    public HttpSessionStore(HttpServletRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        this.request = request;
    }

    @Override
    public Optional<Serializable> get(String key) {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return Optional.empty();
        }
        Object value = attribute(session, key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Serializable serializable) {
            return Optional.of(serializable);
        }
        log.warn("Ignoring non-serializable value of type {} under session key '{}'",
                value.getClass().getName(), key);
        return Optional.empty();
    }

    @Override
    public void set(String key, Serializable value) {
        try {
            request.getSession(true).setAttribute(key, value);
        } catch (IllegalStateException e) {
            throw new SessionStoreException("Cannot write session key '" + key + "'", e);
        }
    }

    @Override
    public void delete(String key) {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return;
        }
        try {
            session.removeAttribute(key);
        } catch (IllegalStateException e) {
            throw new SessionStoreException("Cannot delete session key '" + key + "'", e);
        }
    }

    private static Object attribute(HttpSession session, String key) {
        try {
            return session.getAttribute(key);
        } catch (IllegalStateException e) {
            throw new SessionStoreException("Cannot read session key '" + key + "'", e);
        }
    }
}
