package haven.adapter.in.dto;

/**
 * DTO for invitation requests.
 *
 * @param email invited email address (required)
 * @param role  role offered to the invitee
 */
public record InvitationRequest(String email, String role) {}
