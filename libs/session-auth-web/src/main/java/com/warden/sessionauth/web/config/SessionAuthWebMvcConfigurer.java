package com.warden.sessionauth.web.config;

import com.warden.sessionauth.AccessGuard;
import com.warden.sessionauth.AccessRequirement;
import com.warden.sessionauth.web.AccessGuardInterceptor;
import com.warden.sessionauth.web.CurrentAccountArgumentResolver;
import com.warden.sessionauth.web.SessionStoreArgumentResolver;
import java.util.List;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Installs the access guards and the {@code @CurrentAccount} / {@code SessionStore} argument
 * resolvers into Spring MVC.
 *
 * <p>One interceptor enforces handler annotations everywhere. Configured
 * {@code login-required-paths} and {@code admin-required-paths} each get their own interceptor
 * with a fixed requirement.
 */
public class SessionAuthWebMvcConfigurer implements WebMvcConfigurer {

    private final AccessGuard guard;
    private final SessionAuthProperties properties;

    public SessionAuthWebMvcConfigurer(AccessGuard guard, SessionAuthProperties properties) {
        this.guard = guard;
        this.properties = properties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AccessGuardInterceptor(guard));
        if (!properties.loginRequiredPaths().isEmpty()) {
            registry.addInterceptor(new AccessGuardInterceptor(guard, AccessRequirement.LOGIN))
                    .addPathPatterns(properties.loginRequiredPaths());
        }
        if (!properties.adminRequiredPaths().isEmpty()) {
            registry.addInterceptor(new AccessGuardInterceptor(guard, AccessRequirement.ADMIN))
                    .addPathPatterns(properties.adminRequiredPaths());
        }
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new CurrentAccountArgumentResolver());
        resolvers.add(new SessionStoreArgumentResolver());
    }
}
