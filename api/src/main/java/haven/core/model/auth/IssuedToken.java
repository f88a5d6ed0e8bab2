package haven.core.model.auth;

/**
 * A freshly signed token together with the claims it carries.
 *
 * @param token  compact serialization to hand to the client
 * @param claims the signed claims
 */
public record IssuedToken(String token, TokenClaims claims) {
    public IssuedToken {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Token cannot be null or blank");
        }
        if (claims == null) {
            throw new IllegalArgumentException("Claims cannot be null");
        }
    }
}
