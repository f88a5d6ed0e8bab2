package haven.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import haven.core.exception.FailureKind;
import haven.core.exception.SecurityStateException;
import haven.core.model.auth.TokenClaims;
import haven.core.model.auth.TokenKind;
import haven.support.SecurityStateFixture;

@DisplayName("DomainAuthenticationService")
class DomainAuthenticationServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private SecurityStateFixture fixture;
    private DomainAuthenticationService authentication;

    @BeforeEach
    void setUp() {
        fixture = new SecurityStateFixture();
        authentication = fixture.authentication;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static FailureKind failureOf(Uni<?> operation) {
        return assertThrows(SecurityStateException.class, () -> operation.await().atMost(TIMEOUT)).kind();
    }

    @Nested
    @DisplayName("Domain selection")
    class DomainSelectionTests {

        @Test
        @DisplayName("should select the only domain when none is requested")
        void singleDomain() {
            var pair = authentication.authenticate("alice", "alice-password", null).await().atMost(TIMEOUT);

            assertEquals("north-shelter", pair.domain());
            assertEquals("u-alice", pair.access().claims().subject());
        }

        @Test
        @DisplayName("should bind the requested domain into both tokens")
        void requestedDomain() {
            var pair = authentication.authenticate("bob", "bob-password", "south-shelter").await().atMost(TIMEOUT);

            assertEquals("south-shelter", pair.access().claims().domain());
            assertEquals("south-shelter", pair.refresh().claims().domain());
            assertEquals(
                    "u-bob",
                    fixture.tokens.validate(pair.access().token(), TokenKind.ACCESS)
                            .await()
                            .atMost(TIMEOUT)
                            .subject());
        }

        @Test
        @DisplayName("should carry the principal's permissions")
        void carriesPermissions() {
            var pair = authentication.authenticate("alice", "alice-password", "north-shelter")
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(
                    List.of("crm:write", "users:invite"),
                    pair.access().claims().attributes().get(TokenClaims.PERMISSIONS));
        }

        @Test
        @DisplayName("should require a choice from a principal with several domains")
        void ambiguousDomain() {
            assertEquals(
                    FailureKind.DOMAIN_NOT_AUTHORIZED, failureOf(authentication.authenticate("bob", "bob-password", "")));
        }

        @Test
        @DisplayName("should refuse a principal with no domain at all")
        void noDomain() {
            assertEquals(
                    FailureKind.DOMAIN_NOT_AUTHORIZED,
                    failureOf(authentication.authenticate("carol", "carol-password", null)));
        }

        @Test
        @DisplayName("should refuse a known domain the principal does not belong to")
        void foreignDomain() {
            assertEquals(
                    FailureKind.DOMAIN_NOT_AUTHORIZED,
                    failureOf(authentication.authenticate("alice", "alice-password", "east-shelter")));
        }

        @Test
        @DisplayName("should report an unknown domain")
        void unknownDomain() {
            assertEquals(
                    FailureKind.UNKNOWN_DOMAIN,
                    failureOf(authentication.authenticate("alice", "alice-password", "west-shelter")));
        }
    }

    @Nested
    @DisplayName("Credentials")
    class CredentialTests {

        @Test
        @DisplayName("should refuse a wrong password")
        void wrongPassword() {
            assertEquals(
                    FailureKind.BAD_CREDENTIALS,
                    failureOf(authentication.authenticate("alice", "guess", "north-shelter")));
            verify(fixture.metrics).recordAuthentication(false);
        }

        @Test
        @DisplayName("should not distinguish an unknown user from a wrong password")
        void unknownUser() {
            assertEquals(
                    FailureKind.BAD_CREDENTIALS,
                    failureOf(authentication.authenticate("mallory", "alice-password", "north-shelter")));
        }

        @Test
        @DisplayName("should refuse blank credentials without a lookup")
        void blankCredentials() {
            assertEquals(FailureKind.BAD_CREDENTIALS, failureOf(authentication.authenticate(" ", "x", null)));
            assertEquals(FailureKind.BAD_CREDENTIALS, failureOf(authentication.authenticate("alice", "", null)));
        }

        @Test
        @DisplayName("should check credentials before the domain")
        void credentialsFirst() {
            assertEquals(
                    FailureKind.BAD_CREDENTIALS,
                    failureOf(authentication.authenticate("alice", "guess", "west-shelter")));
        }

        @Test
        @DisplayName("should record a successful login")
        void recordsSuccess() {
            authentication.authenticate("alice", "alice-password", null).await().atMost(TIMEOUT);

            verify(fixture.metrics).recordAuthentication(true);
        }
    }
}
