package com.warden.sessionauth.web;

import com.warden.sessionauth.AccessGuard;
import com.warden.sessionauth.AccessRequirement;
import com.warden.sessionauth.Account;
import com.warden.sessionauth.GuardDecision;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.util.UrlPathHelper;

/**
 * Spring MVC interceptor that applies {@link AccessGuard} before a handler runs.
 *
 * <p>The requirement for a request is the strictest of:
 *
 * <ul>
 *   <li>{@link AdminRequired} or {@link LoginRequired} on the handler method or its class
 *   <li>the fixed requirement this interceptor was registered with for a set of path patterns
 * </ul>
 *
 * <p>Without any requirement the request passes untouched. An unmet requirement sends a 302 to
 * the login page and returns {@code false}, so the handler never runs.
 */
public class AccessGuardInterceptor implements HandlerInterceptor {

    private final AccessGuard guard;
    private final AccessRequirement pathRequirement;

    /**
     * Creates an interceptor driven by handler annotations only.
     */
    public AccessGuardInterceptor(AccessGuard guard) {
        this(guard, null);
    }

    /**
     * Creates an interceptor that enforces {@code pathRequirement} on every request it sees, in
     * addition to handler annotations.
     */
    public AccessGuardInterceptor(AccessGuard guard, AccessRequirement pathRequirement) {
        if (guard == null) {
            throw new IllegalArgumentException("guard must not be null");
        }
        this.guard = guard;
        this.pathRequirement = pathRequirement;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        Optional<AccessRequirement> requirement = requirementFor(handler);
        if (requirement.isEmpty()) {
            return true;
        }

        Account<?> account = RequestAccounts.requireAccount(request);
        GuardDecision decision = guard.check(requirement.get(), account, requestPath(request));
        if (decision.passed()) {
            return true;
        }
        response.sendRedirect(decision.redirectTarget());
        return false;
    }

    Optional<AccessRequirement> requirementFor(Object handler) {
        boolean admin = pathRequirement == AccessRequirement.ADMIN;
        boolean login = pathRequirement == AccessRequirement.LOGIN;

        if (handler instanceof HandlerMethod handlerMethod) {
            admin |= handlerMethod.hasMethodAnnotation(AdminRequired.class)
                    || AnnotatedElementUtils.hasAnnotation(handlerMethod.getBeanType(), AdminRequired.class);
            login |= handlerMethod.hasMethodAnnotation(LoginRequired.class)
                    || AnnotatedElementUtils.hasAnnotation(handlerMethod.getBeanType(), LoginRequired.class);
        }

        if (admin) {
            return Optional.of(AccessRequirement.ADMIN);
        }
        if (login) {
            return Optional.of(AccessRequirement.LOGIN);
        }
        return Optional.empty();
    }

    /** Decoded request path, context path included, without path parameters such as {@code ;jsessionid}. */
    private static String requestPath(HttpServletRequest request) {
        return UrlPathHelper.defaultInstance.getOriginatingRequestUri(request);
    }
}
