package haven.adapter.in.dto;

/**
 * DTO for completing a password reset.
 *
 * @param token       reset token
 * @param newPassword the new password
 */
public record ResetPasswordRequest(String token, String newPassword) {}
