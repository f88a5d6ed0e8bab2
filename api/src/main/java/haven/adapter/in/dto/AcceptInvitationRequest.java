package haven.adapter.in.dto;

/**
 * DTO for redeeming an invitation.
 *
 * @param token invitation token
 * @param email email the invitee registers with; must match the invitation
 */
public record AcceptInvitationRequest(String token, String email) {}
