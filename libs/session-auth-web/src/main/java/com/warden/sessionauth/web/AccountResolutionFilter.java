package com.warden.sessionauth.web;

import com.warden.sessionauth.Account;
import com.warden.sessionauth.AccountContext;
import com.warden.sessionauth.AccountResolver;
import com.warden.sessionauth.SessionStoreException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

/**
 * Servlet filter that resolves the session's account once per request and publishes it.
 *
 * <p>Flow for every request:
 *
 * <ol>
 *   <li>{@link AccountResolver} reads the session through an {@link HttpSessionStore} and binds
 *       an anonymous or authenticated account to a fresh {@link AccountContext}
 *   <li>the context is published as a request attribute, see {@link RequestAccounts}
 *   <li>the account id is put into SLF4J MDC under {@value #MDC_ACCOUNT_ID} for the rest of the
 *       chain, then removed
 * </ol>
 *
 * <p>A {@link SessionStoreException} raised while resolving happens outside the
 * {@code DispatcherServlet}. When a {@link HandlerExceptionResolver} is given, the exception is
 * handed to it so {@code @ExceptionHandler} methods render the response; otherwise it propagates.
 *
 * <p>Registered at {@link #DEFAULT_ORDER}, which places it after session repository filters such
 * as Spring Session's and before anything that needs the account.
 *
 * @param <A> the application's account type
 */
public class AccountResolutionFilter<A extends Account<A>> extends OncePerRequestFilter {

    public static final int DEFAULT_ORDER = Ordered.HIGHEST_PRECEDENCE + 100;

    public static final String MDC_ACCOUNT_ID = "accountId";

    private final AccountResolver<A> resolver;
    private final HandlerExceptionResolver exceptionResolver;

    public AccountResolutionFilter(AccountResolver<A> resolver) {
        this(resolver, null);
    }

    /**
     * @param exceptionResolver renders session store failures, may be null
     */
    public AccountResolutionFilter(AccountResolver<A> resolver, HandlerExceptionResolver exceptionResolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver must not be null");
        }
        this.resolver = resolver;
        this.exceptionResolver = exceptionResolver;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        var context = new AccountContext<A>();
        A account;
        try {
            account = resolver.resolve(new HttpSessionStore(request), context);
        } catch (SessionStoreException e) {
            if (exceptionResolver == null
                    || exceptionResolver.resolveException(request, response, null, e) == null) {
                throw e;
            }
            return;
        }
        RequestAccounts.publish(request, context);

        if (account.isAuthenticated() && account.uniqueId() != null) {
            MDC.put(MDC_ACCOUNT_ID, String.valueOf(account.uniqueId()));
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            // Servlet containers reuse threads.
            MDC.remove(MDC_ACCOUNT_ID);
        }
    }
}
