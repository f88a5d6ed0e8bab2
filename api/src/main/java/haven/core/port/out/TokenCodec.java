package haven.core.port.out;

import haven.core.model.auth.TokenClaims;

/**
 * Port for turning claims into signed, tamper-evident strings and back.
 *
 * <p>The codec checks integrity only. Expiry, kind and revocation are
 * enforced by the caller.
 */
public interface TokenCodec {

    /**
     * Sign the claims with the configured algorithm.
     *
     * @param claims the claims to sign
     * @return compact serialization
     */
    String encode(TokenClaims claims);

    /**
     * Verify and parse a token.
     *
     * @param token compact serialization
     * @return the signed claims
     * @throws haven.core.exception.TokenException with kind MALFORMED, INVALID_SIGNATURE
     *         or UNSUPPORTED_ALGORITHM
     */
    TokenClaims decode(String token);
}
