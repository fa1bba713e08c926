package com.warden.portal.config;

import com.warden.portal.account.MemberDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the member directory, which doubles as the {@code AccountFactory} that activates
 * session authentication.
 */
@Configuration
public class PortalConfig {

    @Bean
    public MemberDirectory memberDirectory(PortalProperties properties) {
        return MemberDirectory.seededFrom(properties.members());
    }
}
