package haven.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Optional;

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

@DisplayName("AccountTokenService")
class AccountTokenServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private SecurityStateFixture fixture;
    private AccountTokenService accounts;

    @BeforeEach
    void setUp() {
        fixture = new SecurityStateFixture();
        accounts = fixture.accountTokens;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static FailureKind failureOf(Uni<?> operation) {
        return assertThrows(SecurityStateException.class, () -> operation.await().atMost(TIMEOUT)).kind();
    }

    @Nested
    @DisplayName("Invitations")
    class InvitationTests {

        @Test
        @DisplayName("should issue a week-long invitation bound to the normalized email")
        void invite() {
            var invitation = accounts.invite("north-shelter", "  New.Volunteer@Example.org ", "volunteer")
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("new.volunteer@example.org", invitation.claims().subject());
            assertEquals("north-shelter", invitation.claims().domain());
            assertEquals(TokenKind.INVITATION, invitation.claims().kind());
            assertEquals(Optional.of("volunteer"), invitation.claims().attribute(TokenClaims.ROLE));
            assertEquals(fixture.clock.instant().plus(Duration.ofDays(7)), invitation.claims().expiresAt());
        }

        @Test
        @DisplayName("should omit the role when none is offered")
        void inviteWithoutRole() {
            var invitation = accounts.invite("north-shelter", "a@example.org", null).await().atMost(TIMEOUT);

            assertFalse(invitation.claims().attributes().containsKey(TokenClaims.ROLE));
        }

        @Test
        @DisplayName("should refuse an unknown domain")
        void unknownDomain() {
            assertEquals(FailureKind.UNKNOWN_DOMAIN, failureOf(accounts.invite("west-shelter", "a@example.org", null)));
        }

        @Test
        @DisplayName("should require an email")
        void blankEmail() {
            var invite = accounts.invite("north-shelter", " ", null);

            assertThrows(IllegalArgumentException.class, () -> invite.await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should accept an invitation exactly once")
        void acceptOnce() {
            var token = accounts.invite("north-shelter", "a@example.org", null).await().atMost(TIMEOUT).token();

            var claims = accounts.acceptInvitation(token, "A@Example.org").await().atMost(TIMEOUT);

            assertEquals("north-shelter", claims.domain());
            assertEquals(FailureKind.REVOKED, failureOf(accounts.acceptInvitation(token, "a@example.org")));
        }

        @Test
        @DisplayName("should not burn the invitation when the email does not match")
        void mismatchDoesNotConsume() {
            var token = accounts.invite("north-shelter", "a@example.org", null).await().atMost(TIMEOUT).token();

            assertEquals(FailureKind.SUBJECT_MISMATCH, failureOf(accounts.acceptInvitation(token, "b@example.org")));
            assertEquals(
                    "a@example.org",
                    accounts.acceptInvitation(token, "a@example.org").await().atMost(TIMEOUT).subject());
        }

        @Test
        @DisplayName("should refuse an expired invitation")
        void expired() {
            var token = accounts.invite("north-shelter", "a@example.org", null).await().atMost(TIMEOUT).token();
            fixture.clock.advance(Duration.ofDays(7).plusSeconds(1));

            assertEquals(FailureKind.EXPIRED, failureOf(accounts.acceptInvitation(token, "a@example.org")));
        }

        @Test
        @DisplayName("should refuse a reset token presented as an invitation")
        void wrongKind() {
            var reset = accounts.requestPasswordReset("north-shelter", "alice").await().atMost(TIMEOUT).token();

            assertEquals(FailureKind.WRONG_KIND, failureOf(accounts.acceptInvitation(reset, "u-alice")));
        }
    }

    @Nested
    @DisplayName("Password reset")
    class PasswordResetTests {

        @Test
        @DisplayName("should issue a half-hour reset token for a member of the domain")
        void requestReset() {
            var reset = accounts.requestPasswordReset("north-shelter", "alice").await().atMost(TIMEOUT);

            assertEquals("u-alice", reset.claims().subject());
            assertEquals(TokenKind.RESET, reset.claims().kind());
            assertEquals(fixture.clock.instant().plus(Duration.ofMinutes(30)), reset.claims().expiresAt());
        }

        @Test
        @DisplayName("should not reveal whether a user exists")
        void unknownUser() {
            assertEquals(
                    FailureKind.BAD_CREDENTIALS, failureOf(accounts.requestPasswordReset("north-shelter", "mallory")));
            assertEquals(
                    FailureKind.BAD_CREDENTIALS, failureOf(accounts.requestPasswordReset("south-shelter", "alice")));
        }

        @Test
        @DisplayName("should change the password and log the principal out everywhere")
        void confirmReset() {
            var session = fixture.authentication.authenticate("alice", "alice-password", null)
                    .await()
                    .atMost(TIMEOUT);
            var reset = accounts.requestPasswordReset("north-shelter", "alice").await().atMost(TIMEOUT).token();

            var subject = accounts.confirmPasswordReset(reset, "new-password").await().atMost(TIMEOUT);

            assertEquals("u-alice", subject);
            assertEquals("new-password", fixture.identityStore.passwordOf("u-alice"));
            assertEquals(
                    FailureKind.REVOKED,
                    failureOf(fixture.tokens.validate(session.access().token(), TokenKind.ACCESS)));
            assertEquals(FailureKind.REVOKED, failureOf(fixture.tokens.refresh(session.refresh().token())));
        }

        @Test
        @DisplayName("should accept a reset token only once")
        void resetOnce() {
            var reset = accounts.requestPasswordReset("north-shelter", "alice").await().atMost(TIMEOUT).token();
            accounts.confirmPasswordReset(reset, "new-password").await().atMost(TIMEOUT);

            assertEquals(FailureKind.REVOKED, failureOf(accounts.confirmPasswordReset(reset, "other-password")));
            assertEquals("new-password", fixture.identityStore.passwordOf("u-alice"));
        }

        @Test
        @DisplayName("should refuse a reset token after 30 minutes")
        void resetExpires() {
            var reset = accounts.requestPasswordReset("north-shelter", "alice").await().atMost(TIMEOUT).token();
            fixture.clock.advance(Duration.ofMinutes(31));

            assertEquals(FailureKind.EXPIRED, failureOf(accounts.confirmPasswordReset(reset, "new-password")));
        }

        @Test
        @DisplayName("should require a new password")
        void emptyPassword() {
            var reset = accounts.requestPasswordReset("north-shelter", "alice").await().atMost(TIMEOUT).token();
            var confirm = accounts.confirmPasswordReset(reset, "");

            assertThrows(IllegalArgumentException.class, () -> confirm.await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("Session-wide revocation")
    class SessionTests {

        @Test
        @DisplayName("changePassword() should revoke existing tokens but allow a fresh login")
        void changePassword() {
            var before = fixture.authentication.authenticate("bob", "bob-password", "north-shelter")
                    .await()
                    .atMost(TIMEOUT);

            accounts.changePassword("u-bob", "bob-new-password").await().atMost(TIMEOUT);

            assertEquals(
                    FailureKind.REVOKED, failureOf(fixture.tokens.validate(before.access().token(), TokenKind.ACCESS)));
            assertEquals(
                    FailureKind.BAD_CREDENTIALS,
                    failureOf(fixture.authentication.authenticate("bob", "bob-password", "north-shelter")));
            var after = fixture.authentication.authenticate("bob", "bob-new-password", "north-shelter")
                    .await()
                    .atMost(TIMEOUT);
            fixture.tokens.validate(after.access().token(), TokenKind.ACCESS).await().atMost(TIMEOUT);
        }

        @Test
        @DisplayName("logoutEverywhere() should revoke every session of the principal")
        void logoutEverywhere() {
            var first = fixture.authentication.authenticate("bob", "bob-password", "north-shelter")
                    .await()
                    .atMost(TIMEOUT);
            var second = fixture.authentication.authenticate("bob", "bob-password", "south-shelter")
                    .await()
                    .atMost(TIMEOUT);

            accounts.logoutEverywhere("u-bob").await().atMost(TIMEOUT);

            assertEquals(
                    FailureKind.REVOKED, failureOf(fixture.tokens.validate(first.access().token(), TokenKind.ACCESS)));
            assertEquals(FailureKind.REVOKED, failureOf(fixture.tokens.refresh(second.refresh().token())));
        }
    }
}
