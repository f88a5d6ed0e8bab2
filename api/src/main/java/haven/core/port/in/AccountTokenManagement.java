package haven.core.port.in;

import io.smallrye.mutiny.Uni;

import haven.core.model.auth.IssuedToken;
import haven.core.model.auth.TokenClaims;

/**
 * Inbound port for account flows driven by single-use tokens: invitations,
 * password resets and credential changes.
 */
public interface AccountTokenManagement {

    /**
     * Issue an invitation into a domain.
     *
     * @param domain target domain
     * @param email  invited email address, becomes the token subject
     * @param role   role offered by the invitation
     */
    Uni<IssuedToken> invite(String domain, String email, String role);

    /**
     * Redeem an invitation. The token is consumed only if the email matches.
     *
     * @return the invitation claims
     */
    Uni<TokenClaims> acceptInvitation(String token, String email);

    /**
     * Issue a password-reset token for a principal of the domain.
     */
    Uni<IssuedToken> requestPasswordReset(String domain, String username);

    /**
     * Redeem a reset token and set a new password. Every previously issued
     * token of the principal becomes invalid.
     *
     * @return Uni with the principal id
     */
    Uni<String> confirmPasswordReset(String token, String newPassword);

    /**
     * Set a new password and invalidate every previously issued token.
     */
    Uni<Void> changePassword(String principalId, String newPassword);

    /**
     * Invalidate every previously issued token of the principal.
     */
    Uni<Void> logoutEverywhere(String principalId);
}
