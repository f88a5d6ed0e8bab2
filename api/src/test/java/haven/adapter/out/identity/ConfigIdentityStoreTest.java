package haven.adapter.out.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import haven.adapter.out.storage.memory.InMemoryCacheStore;
import haven.core.config.IdentityConfig;
import haven.core.config.IdentityConfig.UserConfig;
import haven.core.exception.AuthenticationException;
import haven.core.exception.FailureKind;
import haven.core.util.CacheKeys;
import haven.support.MutableClock;

@DisplayName("ConfigIdentityStore")
class ConfigIdentityStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Argon2PasswordHasher HASHER = new Argon2PasswordHasher(1024, 1, 1);

    private InMemoryCacheStore store;
    private IdentityConfig config;
    private Map<String, UserConfig> users;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore(MutableClock.startingAt("2026-03-02T09:00:00Z"));
        config = mock(IdentityConfig.class);
        users = new LinkedHashMap<>();
        when(config.users()).thenReturn(users);
        when(config.domains()).thenReturn(Optional.of(Set.of("east-shelter")));
        users.put("u-alice", user("alice", "alice-password", Set.of("north-shelter"), Set.of("crm:write")));
        users.put("u-bob", user("bob", "bob-password", Set.of("north-shelter", "south-shelter"), null));
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private static UserConfig user(String username, String password, Set<String> domains, Set<String> permissions) {
        var user = mock(UserConfig.class);
        lenient().when(user.username()).thenReturn(username);
        lenient().when(user.passwordHash()).thenReturn(HASHER.hash(password));
        lenient().when(user.domains()).thenReturn(Optional.ofNullable(domains));
        lenient().when(user.permissions()).thenReturn(Optional.ofNullable(permissions));
        return user;
    }

    private ConfigIdentityStore identityStore() {
        return new ConfigIdentityStore(config, store, new CacheKeys("test:"), HASHER);
    }

    @Nested
    @DisplayName("Credentials")
    class CredentialTests {

        @Test
        @DisplayName("should verify a configured password")
        void verifies() {
            var principal = identityStore().verifyCredentials("alice", "alice-password").await().atMost(TIMEOUT);

            assertEquals("u-alice", principal.orElseThrow().id());
            assertEquals(Set.of("crm:write"), principal.get().permissions());
        }

        @Test
        @DisplayName("should refuse a wrong password or unknown user")
        void refuses() {
            var identities = identityStore();

            assertTrue(identities.verifyCredentials("alice", "bob-password").await().atMost(TIMEOUT).isEmpty());
            assertTrue(identities.verifyCredentials("mallory", "x").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should prefer a changed password over the configured one")
        void changedPassword() {
            var identities = identityStore();

            identities.updatePassword("u-alice", "fresh-password").await().atMost(TIMEOUT);

            assertTrue(identities.verifyCredentials("alice", "fresh-password").await().atMost(TIMEOUT).isPresent());
            assertTrue(identities.verifyCredentials("alice", "alice-password").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should store a salted Argon2id hash for a changed password")
        void storesArgon2() {
            identityStore().updatePassword("u-alice", "fresh-password").await().atMost(TIMEOUT);

            var stored = store.get("test:password:u-alice").await().atMost(TIMEOUT).orElseThrow();
            assertTrue(stored.startsWith("$argon2id$v=19$m=1024,t=1,p=1$"));
            assertFalse(stored.contains("fresh-password"));
        }

        @Test
        @DisplayName("should never accept a hash that is not Argon2")
        void legacyHash() {
            users.put("u-frank", mock(UserConfig.class));
            when(users.get("u-frank").username()).thenReturn("frank");
            // plain hex digest, as unsalted SHA-256 hashes look
            when(users.get("u-frank").passwordHash())
                    .thenReturn("5c0d2c2b4e4b2a37e7f0c0b4e4e2b0b8b1c7d3a0e9f3e9f1d1a2a4b6c8d0e2f4");

            assertTrue(identityStore().verifyCredentials("frank", "frank-password").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should share changed passwords between instances")
        void sharedPassword() {
            identityStore().updatePassword("u-bob", "fresh-password").await().atMost(TIMEOUT);

            assertTrue(identityStore().verifyCredentials("bob", "fresh-password").await().atMost(TIMEOUT).isPresent());
        }

        @Test
        @DisplayName("should refuse a password change for an unknown principal")
        void unknownPrincipal() {
            var error = assertThrows(
                    AuthenticationException.class,
                    () -> identityStore().updatePassword("u-mallory", "x").await().atMost(TIMEOUT));

            assertEquals(FailureKind.BAD_CREDENTIALS, error.kind());
        }
    }

    @Nested
    @DisplayName("Domains")
    class DomainTests {

        @Test
        @DisplayName("should know configured domains and every user's domains")
        void knownDomains() {
            var identities = identityStore();

            assertTrue(identities.isKnownDomain("east-shelter"));
            assertTrue(identities.isKnownDomain("south-shelter"));
            assertFalse(identities.isKnownDomain("west-shelter"));
            assertFalse(identities.isKnownDomain(null));
        }

        @Test
        @DisplayName("should authorize a principal for its own domains only")
        void authorizedDomains() {
            var identities = identityStore();
            var bob = identities.findByUsername("bob").await().atMost(TIMEOUT).orElseThrow();

            assertEquals(Set.of("north-shelter", "south-shelter"), identities.authorizedDomains(bob));
            assertEquals(Set.of(), bob.permissions());
        }
    }

    @Nested
    @DisplayName("Epochs")
    class EpochTests {

        @Test
        @DisplayName("should start at zero and count up")
        void counts() {
            var identities = identityStore();

            assertEquals(0L, identities.currentEpoch("u-alice").await().atMost(TIMEOUT));
            assertEquals(1L, identities.bumpEpoch("u-alice").await().atMost(TIMEOUT));
            assertEquals(2L, identities.bumpEpoch("u-alice").await().atMost(TIMEOUT));
            assertEquals(2L, identities.currentEpoch("u-alice").await().atMost(TIMEOUT));
            assertEquals(0L, identities.currentEpoch("u-bob").await().atMost(TIMEOUT));
        }
    }

    @Test
    @DisplayName("should refuse duplicate usernames")
    void duplicateUsername() {
        users.put("u-alice-2", user("alice", "other", Set.of("north-shelter"), null));

        assertThrows(IllegalStateException.class, ConfigIdentityStoreTest.this::identityStore);
    }

    @Test
    @DisplayName("should look principals up by id")
    void findById() {
        assertEquals("bob", identityStore().findById("u-bob").await().atMost(TIMEOUT).orElseThrow().username());
        assertEquals(Optional.empty(), identityStore().findById("u-mallory").await().atMost(TIMEOUT));
    }
}
