package haven.adapter.in.dto;

import haven.core.model.auth.TokenPair;

/**
 * Response body of login and refresh. The refresh token travels in a cookie.
 *
 * @param accessToken access token to send as a Bearer credential
 * @param tokenType   always "bearer"
 * @param expiresAt   access token expiry (ISO-8601)
 * @param domain      domain the tokens are bound to
 */
public record TokenResponse(String accessToken, String tokenType, String expiresAt, String domain) {

    public static TokenResponse fromPair(TokenPair pair) {
        return new TokenResponse(
                pair.access().token(),
                "bearer",
                pair.access().claims().expiresAt().toString(),
                pair.domain());
    }
}
