package haven.core.model.auth;

/**
 * Access and refresh tokens minted together by login or refresh.
 */
public record TokenPair(IssuedToken access, IssuedToken refresh) {
    public TokenPair {
        if (access == null || refresh == null) {
            throw new IllegalArgumentException("Both access and refresh tokens are required");
        }
        if (access.claims().kind() != TokenKind.ACCESS || refresh.claims().kind() != TokenKind.REFRESH) {
            throw new IllegalArgumentException("Token pair must contain an access and a refresh token");
        }
    }

    public String domain() {
        return access.claims().domain();
    }
}
