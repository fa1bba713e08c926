package com.warden.portal;

import com.warden.portal.config.PortalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Warden Account Portal: reference Spring Boot application embedding session authentication.
 *
 * <p>What the application supplies:
 *
 * <ol>
 *   <li>an account type ({@link com.warden.portal.account.Member})
 *   <li>an {@code AccountFactory} bean ({@link com.warden.portal.account.MemberDirectory})
 *   <li>login and logout endpoints that call {@code SessionAuthenticator}
 * </ol>
 *
 * <p>Everything else (resolution filter, guards, {@code @CurrentAccount}) comes from the
 * session-auth-web auto-configuration.
 */
@SpringBootApplication
@EnableConfigurationProperties(PortalProperties.class)
public class PortalApplication {

    private static final Logger log = LoggerFactory.getLogger(PortalApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PortalApplication.class, args);
        log.info("Warden Account Portal started successfully");
    }
}
