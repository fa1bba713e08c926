package com.warden.portal.infrastructure.web;

import com.warden.portal.account.InvalidCredentialsException;
import com.warden.sessionauth.SessionStoreException;
import com.warden.sessionauth.web.AccountResolutionFilter;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://warden.dev/errors/unauthorized",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Invalid username or password",
 *   "timestamp": "2026-10-19T10:30:00Z"
 * }
 * </pre>
 *
 * <p>Failed guards never reach this class; they end in a redirect, not an error.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidCredentialsException.class)
    public ProblemDetail handleInvalidCredentials(InvalidCredentialsException ex) {
        log.warn("Rejected login for '{}'", ex.username());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(SessionStoreException.class)
    public ProblemDetail handleSessionStore(SessionStoreException ex) {
        log.error("Session store failure", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", "session-store",
                "Session storage is unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://warden.dev/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        String accountId = MDC.get(AccountResolutionFilter.MDC_ACCOUNT_ID);
        if (accountId != null) {
            problem.setProperty("accountId", accountId);
        }
        return problem;
    }
}
