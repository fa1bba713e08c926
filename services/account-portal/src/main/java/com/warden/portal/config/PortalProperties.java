package com.warden.portal.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the portal, bound from {@code warden.portal.*}.
 *
 * <pre>
 * warden:
 *   portal:
 *     name: account-portal
 *     environment: production
 *     members:
 *       - username: ada
 *         password: change-me
 *         display-name: Ada Lovelace
 *         admin: true
 * </pre>
 *
 * @param name service name used in logs and the info endpoint. Required.
 * @param environment deployment environment (development, staging, production)
 * @param members accounts seeded into the in-memory directory at startup
 */
@ConfigurationProperties(prefix = "warden.portal")
@Validated
public record PortalProperties(@NotBlank String name, String environment, @Valid List<MemberSeed> members) {

    public PortalProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        members = members == null ? List.of() : List.copyOf(members);
    }

    /**
     * One seeded member.
     *
     * @param username unique login name, also the id stored in the session
     * @param password login password
     * @param displayName human-readable name (defaults to the username)
     * @param admin whether the member may use admin routes
     */
    public record MemberSeed(@NotBlank String username, @NotBlank String password, String displayName, boolean admin) {

        public MemberSeed {
            if (displayName == null || displayName.isBlank()) {
                displayName = username;
            }
        }
    }
}
