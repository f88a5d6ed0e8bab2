package haven.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import haven.adapter.in.auth.BearerTokenResolver;
import haven.adapter.in.auth.RefreshCookieManager;
import haven.adapter.in.dto.AcceptInvitationRequest;
import haven.adapter.in.dto.InvitationRequest;
import haven.adapter.in.dto.InvitationResponse;
import haven.adapter.in.dto.MessageResponse;
import haven.adapter.in.dto.ResetPasswordRequest;
import haven.adapter.in.dto.TokenResponse;
import haven.adapter.in.problem.SecurityProblem;
import haven.core.exception.AuthenticationException;
import haven.core.model.auth.Permission;
import haven.core.model.auth.TokenPair;
import haven.core.port.in.AccountTokenManagement;
import haven.core.port.in.DomainAuthentication;
import haven.core.port.in.TokenManagement;
import haven.core.port.out.TokenDelivery;

/**
 * REST resource for login, token rotation and account token flows.
 *
 * <p>Access tokens are returned in the body; refresh tokens only ever travel
 * in an HttpOnly cookie scoped to {@code /auth}.
 */
@Path("/auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);

    private final DomainAuthentication authentication;
    private final TokenManagement tokenManagement;
    private final AccountTokenManagement accountTokens;
    private final TokenDelivery tokenDelivery;
    private final BearerTokenResolver bearerTokenResolver;
    private final RefreshCookieManager cookieManager;

    @Inject
    public AuthResource(
            DomainAuthentication authentication,
            TokenManagement tokenManagement,
            AccountTokenManagement accountTokens,
            TokenDelivery tokenDelivery,
            BearerTokenResolver bearerTokenResolver,
            RefreshCookieManager cookieManager) {
        this.authentication = authentication;
        this.tokenManagement = tokenManagement;
        this.accountTokens = accountTokens;
        this.tokenDelivery = tokenDelivery;
        this.bearerTokenResolver = bearerTokenResolver;
        this.cookieManager = cookieManager;
    }

    /**
     * Password grant.
     *
     * @param username login name
     * @param password password
     * @param domain   domain to log into, optional for single-domain users
     * @return 200 with the access token, refresh token set as a cookie
     */
    @POST
    @Path("/login")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<Response> login(
            @FormParam("username") String username,
            @FormParam("password") String password,
            @FormParam("domain") String domain) {
        return authentication.authenticate(username, password, domain).map(this::tokenResponse);
    }

    /**
     * Rotate the refresh token from the cookie into a new pair.
     */
    @POST
    @Path("/refresh")
    public Uni<Response> refresh(@Context HttpHeaders headers) {
        final var cookie = headers.getCookies().get(cookieManager.cookieName());
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            throw SecurityProblem.unauthorized("Refresh token cookie required");
        }
        return tokenManagement.refresh(cookie.getValue()).map(this::tokenResponse);
    }

    /**
     * Revoke the presented access token and the refresh token issued with it.
     */
    @POST
    @Path("/logout")
    public Uni<Response> logout(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var token = bearerTokenResolver.extract(authorization);
        return tokenManagement.logout(token).map(v -> Response.ok(new MessageResponse("User logged out"))
                .cookie(cookieManager.createLogoutCookie())
                .build());
    }

    /**
     * Invalidate every token of the caller on every device.
     */
    @POST
    @Path("/logout/all")
    public Uni<Response> logoutEverywhere(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        return bearerTokenResolver
                .resolve(authorization)
                .flatMap(claims -> accountTokens.logoutEverywhere(claims.subject()))
                .map(v -> Response.noContent()
                        .cookie(cookieManager.createLogoutCookie())
                        .build());
    }

    /**
     * Invite someone into the caller's domain.
     *
     * @return 202 once the invitation has been handed to delivery
     */
    @POST
    @Path("/invite/{domain}")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> invite(
            @PathParam("domain") String domain,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            InvitationRequest request) {
        if (request == null || request.email() == null || request.email().isBlank()) {
            throw SecurityProblem.badRequest("Email is required");
        }
        return bearerTokenResolver
                .resolve(authorization)
                .flatMap(claims -> {
                    if (!domain.equals(claims.domain())) {
                        throw AuthenticationException.domainNotAuthorized(domain);
                    }
                    if (!Permission.isGranted(claims, Permission.USERS_INVITE)) {
                        throw SecurityProblem.forbidden("Permission required: " + Permission.USERS_INVITE);
                    }
                    return accountTokens.invite(domain, request.email(), request.role());
                })
                .flatMap(token -> tokenDelivery.deliver(token.claims().subject(), token))
                .map(v -> Response.accepted(new MessageResponse("Invitation email sent")).build());
    }

    /**
     * Redeem an invitation.
     *
     * @return 200 with the invited email, domain and role
     */
    @POST
    @Path("/invitation/accept")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<InvitationResponse> acceptInvitation(AcceptInvitationRequest request) {
        if (request == null || request.token() == null || request.email() == null) {
            throw SecurityProblem.badRequest("Token and email are required");
        }
        return accountTokens.acceptInvitation(request.token(), request.email()).map(InvitationResponse::fromClaims);
    }

    /**
     * Start a password reset.
     *
     * @return 202 once the reset token has been handed to delivery
     */
    @POST
    @Path("/password/forgot/{domain}/{username}")
    public Uni<Response> forgotPassword(@PathParam("domain") String domain, @PathParam("username") String username) {
        return accountTokens
                .requestPasswordReset(domain, username)
                .flatMap(token -> tokenDelivery.deliver(username, token))
                .map(v -> Response.accepted(new MessageResponse("Reset password email sent")).build());
    }

    /**
     * Complete a password reset. Every existing session of the user ends.
     */
    @POST
    @Path("/password/reset")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<MessageResponse> resetPassword(ResetPasswordRequest request) {
        if (request == null || request.token() == null || request.newPassword() == null) {
            throw SecurityProblem.badRequest("Token and new password are required");
        }
        return accountTokens
                .confirmPasswordReset(request.token(), request.newPassword())
                .map(principalId -> {
                    LOG.infof("Password reset completed for %s", principalId);
                    return new MessageResponse("Password changed");
                });
    }

    private Response tokenResponse(TokenPair pair) {
        return Response.ok(TokenResponse.fromPair(pair))
                .cookie(cookieManager.createCookie(pair.refresh()))
                .build();
    }
}
