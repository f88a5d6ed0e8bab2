package haven.adapter.in.dto;

import haven.core.model.auth.TokenClaims;

/**
 * What an accepted invitation grants.
 */
public record InvitationResponse(String email, String domain, String role) {

    public static InvitationResponse fromClaims(TokenClaims claims) {
        return new InvitationResponse(
                claims.subject(), claims.domain(), claims.attribute(TokenClaims.ROLE).orElse(null));
    }
}
