package haven.core.port.in;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import haven.core.model.auth.IssuedToken;
import haven.core.model.auth.TokenClaims;
import haven.core.model.auth.TokenKind;
import haven.core.model.auth.TokenPair;

/**
 * Inbound port for the token lifecycle: issuance, validation, rotation and
 * revocation of bearer tokens.
 *
 * <p>Failures are delivered as {@link haven.core.exception.SecurityStateException}
 * subclasses through the returned Uni.
 */
public interface TokenManagement {

    /**
     * Issue a token of the given kind.
     *
     * @param subject        principal id (or invited email)
     * @param domain         domain to bind, may be null
     * @param kind           token kind
     * @param customDuration overrides the configured lifetime when non-null
     * @param attributes     kind-specific claims
     * @return the signed token
     */
    Uni<IssuedToken> issue(
            String subject, String domain, TokenKind kind, Duration customDuration, Map<String, Object> attributes);

    /**
     * Issue an access token and its paired refresh token.
     */
    Uni<TokenPair> issuePair(String principalId, String domain, Set<String> permissions);

    /**
     * Fully validate a token. Single-use kinds are consumed on success.
     *
     * @param token        compact token
     * @param expectedKind the only kind that is accepted
     * @return the claims
     */
    Uni<TokenClaims> validate(String token, TokenKind expectedKind);

    /**
     * Validate without consuming a single-use token.
     */
    Uni<TokenClaims> inspect(String token, TokenKind expectedKind);

    /**
     * Rotate a refresh token into a new access/refresh pair. The presented
     * token can be used only once.
     */
    Uni<TokenPair> refresh(String refreshToken);

    /**
     * Denylist a token's nonce. Only the signature is checked; revoking an
     * already revoked or expired token succeeds.
     */
    Uni<Void> revoke(String token);

    /**
     * Revoke an access token together with the refresh token issued with it.
     * Only the signature and kind are checked, so an expired access token
     * still ends its session.
     */
    Uni<Void> logout(String accessToken);

    /**
     * Invalidate every token issued to the principal so far.
     *
     * @return Uni with the new epoch
     */
    Uni<Long> revokeAll(String principalId);
}
