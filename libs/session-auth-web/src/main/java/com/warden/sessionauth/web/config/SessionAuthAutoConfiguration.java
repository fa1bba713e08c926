package com.warden.sessionauth.web.config;

import com.warden.sessionauth.AccessGuard;
import com.warden.sessionauth.Account;
import com.warden.sessionauth.AccountFactory;
import com.warden.sessionauth.AccountResolver;
import com.warden.sessionauth.SessionAuthSettings;
import com.warden.sessionauth.SessionAuthenticator;
import com.warden.sessionauth.web.AccountResolutionFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.DispatcherServlet;
import org.springframework.web.servlet.HandlerExceptionResolver;

/**
 * Spring Boot auto-configuration for session authentication in servlet applications.
 *
 * <p>Activates when the application defines an {@link AccountFactory} bean for its account type
 * and {@code warden.session-auth.enabled} is not {@code false}. It then registers:
 *
 * <ul>
 *   <li>{@link SessionAuthSettings} built from {@link SessionAuthProperties}
 *   <li>{@link AccountResolver} and the {@link AccountResolutionFilter} that runs it
 *   <li>{@link SessionAuthenticator} for login, logout and session sync in controllers
 *   <li>{@link AccessGuard} plus the MVC interceptors and argument resolvers
 * </ul>
 *
 * <p>Every bean except the filter registration backs off when the application declares its own.
 */
@AutoConfiguration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnBean(AccountFactory.class)
@ConditionalOnProperty(prefix = "warden.session-auth", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SessionAuthProperties.class)
public class SessionAuthAutoConfiguration {

    /** Bean name of the filter registration. */
    public static final String FILTER_REGISTRATION_BEAN = "accountResolutionFilterRegistration";

    private static final Logger log = LoggerFactory.getLogger(SessionAuthAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SessionAuthSettings sessionAuthSettings(SessionAuthProperties properties) {
        SessionAuthSettings settings = properties.toSettings();
        log.info("Session authentication enabled (session key '{}', login '{}', admin login '{}')",
                settings.sessionKey(), settings.redirectUrl(), settings.adminRedirectUrl());
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public AccountResolver<?> accountResolver(AccountFactory<?> accountFactory, SessionAuthSettings settings) {
        return resolverFor(accountFactory, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionAuthenticator sessionAuthenticator(SessionAuthSettings settings) {
        return new SessionAuthenticator(settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessGuard accessGuard(SessionAuthSettings settings) {
        return new AccessGuard(settings);
    }

    @Bean(name = FILTER_REGISTRATION_BEAN)
    public FilterRegistrationBean<AccountResolutionFilter<?>> accountResolutionFilterRegistration(
            AccountResolver<?> accountResolver,
            @Qualifier(DispatcherServlet.HANDLER_EXCEPTION_RESOLVER_BEAN_NAME)
            ObjectProvider<HandlerExceptionResolver> exceptionResolver) {
        FilterRegistrationBean<AccountResolutionFilter<?>> registration =
                new FilterRegistrationBean<>(filterFor(accountResolver, exceptionResolver.getIfAvailable()));
        registration.setOrder(AccountResolutionFilter.DEFAULT_ORDER);
        registration.addUrlPatterns("/*");
        return registration;
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionAuthWebMvcConfigurer sessionAuthWebMvcConfigurer(
            AccessGuard accessGuard, SessionAuthProperties properties) {
        return new SessionAuthWebMvcConfigurer(accessGuard, properties);
    }

    // ── Private Helpers ──

    private static <A extends Account<A>> AccountResolver<A> resolverFor(
            AccountFactory<A> accountFactory, SessionAuthSettings settings) {
        return new AccountResolver<>(accountFactory, settings);
    }

    private static <A extends Account<A>> AccountResolutionFilter<A> filterFor(
            AccountResolver<A> resolver, HandlerExceptionResolver exceptionResolver) {
        return new AccountResolutionFilter<>(resolver, exceptionResolver);
    }
}
