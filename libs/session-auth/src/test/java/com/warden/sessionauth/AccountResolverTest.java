package com.warden.sessionauth;

import com.warden.sessionauth.testing.InMemorySessionStore;
import com.warden.sessionauth.testing.StubAccount;
import com.warden.sessionauth.testing.StubAccountDirectory;
import java.io.Serializable;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AccountResolver")
class AccountResolverTest {

    private static final String KEY = SessionAuthSettings.DEFAULT_SESSION_KEY;

    private StubAccountDirectory directory;
    private InMemorySessionStore session;
    private AccountResolver<StubAccount> resolver;

    @BeforeEach
    void setUp() {
        directory = new StubAccountDirectory()
                .register("u-1", "Ada", false)
                .register("u-2", "Grace", true);
        session = new InMemorySessionStore();
        resolver = new AccountResolver<>(directory, SessionAuthSettings.defaults());
    }

    @Nested
    @DisplayName("without a session entry")
    class Anonymous {

        @Test
        @DisplayName("binds an unauthenticated zero-value account")
        void bindsAnonymous() {
            var context = new AccountContext<StubAccount>();

            StubAccount account = resolver.resolve(session, context);

            assertThat(account.isAuthenticated()).isFalse();
            assertThat(account.uniqueId()).isNull();
            assertThat(context.requireAccount()).isSameAs(account);
            assertThat(context.state()).isEqualTo(ResolutionState.ANONYMOUS);
        }

        @Test
        @DisplayName("hands every request its own anonymous instance")
        void freshInstancePerRequest() {
            StubAccount first = resolver.resolve(session, new AccountContext<>());
            StubAccount second = resolver.resolve(session, new AccountContext<>());

            assertThat(first).isNotSameAs(second);
        }
    }

    @Nested
    @DisplayName("with a resolvable session entry")
    class Authenticated {

        @Test
        @DisplayName("binds the loaded account, logged in, with the stored id")
        void bindsLoadedAccount() {
            session.set(KEY, "u-1");
            var context = new AccountContext<StubAccount>();

            StubAccount account = resolver.resolve(session, context);

            assertThat(account.isAuthenticated()).isTrue();
            assertThat(account.uniqueId()).isEqualTo("u-1");
            assertThat(account.name()).isEqualTo("Ada");
            assertThat(account.loginCount()).isEqualTo(1);
            assertThat(context.state()).isEqualTo(ResolutionState.AUTHENTICATED);
        }

        @Test
        @DisplayName("reads the configured session key")
        void honoursCustomKey() {
            var custom = new AccountResolver<>(directory, SessionAuthSettings.defaults().withSessionKey("uid"));
            session.set(KEY, "u-1");
            session.set("uid", "u-2");

            StubAccount account = custom.resolve(session, new AccountContext<>());

            assertThat(account.uniqueId()).isEqualTo("u-2");
            assertThat(account.isAdmin()).isTrue();
        }

        @Test
        @DisplayName("never writes to the session")
        void readOnlyTowardSession() {
            SessionStore store = mock(SessionStore.class);
            when(store.get(KEY)).thenReturn(Optional.of("u-1"));

            resolver.resolve(store, new AccountContext<>());

            verify(store, never()).set(anyString(), any());
            verify(store, never()).delete(anyString());
        }
    }

    @Nested
    @DisplayName("with a stale session entry")
    class Stale {

        @Test
        @DisplayName("falls back to the anonymous account without throwing")
        void fallsBackToAnonymous() {
            session.set(KEY, "deleted-user");
            var context = new AccountContext<StubAccount>();

            StubAccount account = resolver.resolve(session, context);

            assertThat(account.isAuthenticated()).isFalse();
            assertThat(account.uniqueId()).isNull();
            assertThat(context.state()).isEqualTo(ResolutionState.ANONYMOUS);
        }

        @Test
        @DisplayName("leaves the stale id in the session by default")
        void keepsStaleIdByDefault() {
            session.set(KEY, "deleted-user");

            resolver.resolve(session, new AccountContext<>());

            assertThat(session.get(KEY)).contains("deleted-user");
        }

        @Test
        @DisplayName("evicts the stale id when configured to")
        void evictsStaleIdWhenEnabled() {
            var evicting = new AccountResolver<>(directory, SessionAuthSettings.defaults().withEvictStaleIdentity(true));
            session.set(KEY, "deleted-user");

            evicting.resolve(session, new AccountContext<>());

            assertThat(session.get(KEY)).isEmpty();
        }

        @Test
        @DisplayName("treats a wrapped directory failure as a lookup failure")
        void directoryFailureDegrades() {
            directory.failOn("u-1", new IllegalStateException("directory offline"));
            session.set(KEY, "u-1");

            StubAccount account = resolver.resolve(session, new AccountContext<>());

            assertThat(account.isAuthenticated()).isFalse();
        }

        @Test
        @DisplayName("treats a null lookup result as a lookup failure")
        void nullLookupDegrades() {
            AccountFactory<NullLookupAccount> factory = NullLookupAccount::new;
            var nullResolver = new AccountResolver<>(factory, SessionAuthSettings.defaults());
            session.set(KEY, "anything");

            NullLookupAccount account = nullResolver.resolve(session, new AccountContext<>());

            assertThat(account.isAuthenticated()).isFalse();
        }
    }

    @Nested
    @DisplayName("failure propagation")
    class Failures {

        @Test
        @DisplayName("propagates session store failures")
        void propagatesStoreFailure() {
            SessionStore broken = mock(SessionStore.class);
            when(broken.get(anyString())).thenThrow(new SessionStoreException("store unavailable"));

            assertThatThrownBy(() -> resolver.resolve(broken, new AccountContext<>()))
                    .isInstanceOf(SessionStoreException.class)
                    .hasMessage("store unavailable");
        }

        @Test
        @DisplayName("rejects a factory that returns null")
        void rejectsNullFactoryResult() {
            AccountFactory<StubAccount> factory = () -> null;
            var broken = new AccountResolver<>(factory, SessionAuthSettings.defaults());

            assertThatThrownBy(() -> broken.resolve(session, new AccountContext<>()))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("refuses to bind a second account to the same request")
        void refusesDoubleResolution() {
            var context = new AccountContext<StubAccount>();
            resolver.resolve(session, context);

            assertThatThrownBy(() -> resolver.resolve(session, context))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    static final class NullLookupAccount implements Account<NullLookupAccount> {

        private boolean authenticated;

        @Override
        public boolean isAuthenticated() {
            return authenticated;
        }

        @Override
        public boolean isAdmin() {
            return false;
        }

        @Override
        public void login() {
            authenticated = true;
        }

        @Override
        public void logout() {
            authenticated = false;
        }

        @Override
        public Serializable uniqueId() {
            return null;
        }

        @Override
        public NullLookupAccount getById(Serializable id) {
            return null;
        }
    }
}
