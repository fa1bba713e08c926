package com.warden.portal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.warden.portal.config.PortalProperties;
import com.warden.sessionauth.SessionAuthSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * End-to-end tests of the portal: full Spring context, session authentication auto-configured
 * from session-auth-web, requests driven through MockMvc. Uses the 'test' profile, which seeds
 * the member directory.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Account Portal")
class PortalApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    private MockHttpSession login(String username, String password) throws Exception {
        var result = mockMvc.perform(post("/account/login")
                        .param("username", username)
                        .param("password", password))
                .andExpect(status().isFound())
                .andReturn();
        return (MockHttpSession) result.getRequest().getSession(false);
    }

    @Test
    @DisplayName("Spring context loads with session authentication configured")
    void contextLoads() {
        assertThat(context.getBean(PortalProperties.class).name()).isEqualTo("account-portal-test");
        assertThat(context.getBean(SessionAuthSettings.class).sessionKey()).isEqualTo("AUTH_UNIQUE_ID");
    }

    @Test
    @DisplayName("Actuator health endpoint is available")
    void actuatorHealthEndpointIsAvailable() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }

    @Nested
    @DisplayName("anonymous visitor")
    class Anonymous {

        @Test
        @DisplayName("is redirected from /dashboard to the login page with next=/dashboard")
        void redirectedFromDashboard() throws Exception {
            mockMvc.perform(get("/dashboard"))
                    .andExpect(status().isFound())
                    .andExpect(redirectedUrl("/account/login?next=/dashboard"));
        }

        @Test
        @DisplayName("is redirected from admin pages to the admin login page")
        void redirectedFromAdmin() throws Exception {
            mockMvc.perform(get("/admin/members"))
                    .andExpect(status().isFound())
                    .andExpect(redirectedUrl("/admin/account/login?next=/admin/members"));
        }

        @Test
        @DisplayName("sees itself as unauthenticated on /api/v1/me")
        void meIsAnonymous() throws Exception {
            mockMvc.perform(get("/api/v1/me"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.authenticated").value(false))
                    .andExpect(jsonPath("$.username").doesNotExist());
        }

        @Test
        @DisplayName("gets the requested path echoed by the login form")
        void loginFormEchoesNext() throws Exception {
            mockMvc.perform(get("/account/login").param("next", "/dashboard"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.next").value("/dashboard"))
                    .andExpect(jsonPath("$.authenticated").value(false));
        }
    }

    @Nested
    @DisplayName("login")
    class Login {

        @Test
        @DisplayName("returns to the intercepted page and authenticates later requests")
        void loginThenDashboard() throws Exception {
            var result = mockMvc.perform(post("/account/login")
                            .param("username", "bob")
                            .param("password", "can-we-fix-it")
                            .param("next", "/dashboard"))
                    .andExpect(status().isFound())
                    .andExpect(redirectedUrl("/dashboard"))
                    .andReturn();
            var session = (MockHttpSession) result.getRequest().getSession(false);

            assertThat(session.getAttribute("AUTH_UNIQUE_ID")).isEqualTo("bob");
            mockMvc.perform(get("/dashboard").session(session))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.greeting").value("Welcome, Bob Builder"))
                    .andExpect(jsonPath("$.member.authenticated").value(true));
        }

        @Test
        @DisplayName("rejects a wrong password with 401 and leaves the session unauthenticated")
        void wrongPassword() throws Exception {
            mockMvc.perform(post("/account/login").param("username", "bob").param("password", "nope"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.title").value("Unauthorized"));
        }

        @Test
        @DisplayName("never redirects off-site")
        void ignoresOffSiteNext() throws Exception {
            mockMvc.perform(post("/account/login")
                            .param("username", "bob")
                            .param("password", "can-we-fix-it")
                            .param("next", "//evil.example"))
                    .andExpect(redirectedUrl("/"));
        }

        @Test
        @DisplayName("admin login refuses non-admin members")
        void adminLoginRefusesMembers() throws Exception {
            mockMvc.perform(post("/admin/account/login").param("username", "bob").param("password", "can-we-fix-it"))
                    .andExpect(status().isUnauthorized());
        }
    }

    @Nested
    @DisplayName("authenticated member")
    class AuthenticatedMember {

        @Test
        @DisplayName("without admin privilege is redirected from admin pages")
        void nonAdminRedirected() throws Exception {
            var session = login("bob", "can-we-fix-it");

            mockMvc.perform(get("/admin/members").session(session))
                    .andExpect(status().isFound())
                    .andExpect(redirectedUrl("/admin/account/login?next=/admin/members"));
        }

        @Test
        @DisplayName("with admin privilege reaches admin pages")
        void adminAllowed() throws Exception {
            var session = login("ada", "analytical-engine");

            mockMvc.perform(get("/admin/members").session(session))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].username").value("ada"));
        }

        @Test
        @DisplayName("is anonymous again after logout")
        void logout() throws Exception {
            var session = login("bob", "can-we-fix-it");

            mockMvc.perform(post("/account/logout").session(session))
                    .andExpect(status().isFound())
                    .andExpect(redirectedUrl("/account/login"));

            assertThat(session.getAttribute("AUTH_UNIQUE_ID")).isNull();
            mockMvc.perform(get("/dashboard").session(session))
                    .andExpect(redirectedUrl("/account/login?next=/dashboard"));
        }

        @Test
        @DisplayName("degrades to anonymous once removed from the directory")
        void removedMemberDegrades() throws Exception {
            var daveSession = login("dave", "open-the-pod-bay-doors");
            var adaSession = login("ada", "analytical-engine");

            mockMvc.perform(delete("/admin/members/dave").session(adaSession))
                    .andExpect(status().isNoContent());

            mockMvc.perform(get("/api/v1/me").session(daveSession))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.authenticated").value(false));
            assertThat(daveSession.getAttribute("AUTH_UNIQUE_ID")).isEqualTo("dave");
        }
    }

    @Nested
    @DisplayName("session storage failure")
    class SessionStorageFailure {

        @Test
        @DisplayName("is answered with a 503 problem response")
        void unreadableSession() throws Exception {
            var broken = new MockHttpSession() {
                @Override
                public Object getAttribute(String name) {
                    throw new IllegalStateException("session backend unavailable");
                }
            };

            mockMvc.perform(get("/api/v1/me").session(broken))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.status").value(503))
                    .andExpect(jsonPath("$.type").value("https://warden.dev/errors/session-store"))
                    .andExpect(jsonPath("$.detail").value("Session storage is unavailable"));
        }
    }
}
