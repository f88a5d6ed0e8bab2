package haven.core.model.auth;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * The signed claim set of a token.
 *
 * @param subject   principal id (or the invited email for invitation tokens)
 * @param domain    tenant the token is bound to, null when unbound
 * @param kind      token kind
 * @param issuedAt  issuance time
 * @param expiresAt expiry time
 * @param nonce     unique per issuance; the unit of revocation
 * @param epoch     the subject's token epoch at issuance
 * @param attributes kind-specific extra claims
 */
public record TokenClaims(
        String subject,
        String domain,
        TokenKind kind,
        Instant issuedAt,
        Instant expiresAt,
        String nonce,
        long epoch,
        Map<String, Object> attributes) {

    /** Access token attribute holding the nonce of the refresh token issued with it. */
    public static final String REFRESH_ID = "rid";

    /** Access token attribute holding the expiry (epoch seconds) of the paired refresh token. */
    public static final String REFRESH_EXPIRES_AT = "rxp";

    /** Principal permissions carried by access and refresh tokens. */
    public static final String PERMISSIONS = "permissions";

    /** Role offered by an invitation. */
    public static final String ROLE = "role";

    public TokenClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Kind cannot be null");
        }
        if (issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("IssuedAt and expiresAt are required");
        }
        if (nonce == null || nonce.isBlank()) {
            throw new IllegalArgumentException("Nonce cannot be null or blank");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Check whether the token has expired at the given instant.
     */
    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public Optional<String> attribute(String name) {
        var value = attributes.get(name);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }
}
