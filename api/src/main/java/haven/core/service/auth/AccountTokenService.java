package haven.core.service.auth;

import java.util.Locale;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import haven.core.exception.AuthenticationException;
import haven.core.exception.TokenException;
import haven.core.model.auth.IssuedToken;
import haven.core.model.auth.TokenClaims;
import haven.core.model.auth.TokenKind;
import haven.core.port.in.AccountTokenManagement;
import haven.core.port.in.TokenManagement;
import haven.core.port.out.IdentityStore;

/**
 * Invitation and password flows built on single-use tokens.
 *
 * <p>Delivering the tokens (by email or otherwise) is left to the caller.
 */
@ApplicationScoped
public class AccountTokenService implements AccountTokenManagement {

    private static final Logger LOG = Logger.getLogger(AccountTokenService.class);

    private final TokenManagement tokenManagement;
    private final IdentityStore identityStore;

    @Inject
    public AccountTokenService(TokenManagement tokenManagement, IdentityStore identityStore) {
        this.tokenManagement = tokenManagement;
        this.identityStore = identityStore;
    }

    @Override
    public Uni<IssuedToken> invite(String domain, String email, String role) {
        if (email == null || email.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Email is required"));
        }
        if (!identityStore.isKnownDomain(domain)) {
            return Uni.createFrom().failure(AuthenticationException.unknownDomain(domain));
        }

        final Map<String, Object> attributes = role == null || role.isBlank() ? Map.of() : Map.of(TokenClaims.ROLE, role);
        return tokenManagement
                .issue(normalizeEmail(email), domain, TokenKind.INVITATION, null, attributes)
                .invoke(token -> LOG.infof("Issued invitation into %s", domain));
    }

    @Override
    public Uni<TokenClaims> acceptInvitation(String token, String email) {
        return tokenManagement
                .inspect(token, TokenKind.INVITATION)
                .flatMap(claims -> {
                    if (email == null || !claims.subject().equalsIgnoreCase(email.trim())) {
                        return Uni.createFrom().<TokenClaims>failure(TokenException.subjectMismatch());
                    }
                    return tokenManagement.validate(token, TokenKind.INVITATION);
                })
                .invoke(claims -> LOG.infof("Invitation into %s accepted", claims.domain()));
    }

    @Override
    public Uni<IssuedToken> requestPasswordReset(String domain, String username) {
        return identityStore.findByUsername(username).flatMap(found -> {
            if (found.isEmpty()
                    || domain == null
                    || !identityStore.authorizedDomains(found.get()).contains(domain)) {
                LOG.debugf("Password reset refused for %s in %s", username, domain);
                return Uni.createFrom().<IssuedToken>failure(AuthenticationException.badCredentials());
            }
            return tokenManagement.issue(found.get().id(), domain, TokenKind.RESET, null, Map.of());
        });
    }

    @Override
    public Uni<String> confirmPasswordReset(String token, String newPassword) {
        if (newPassword == null || newPassword.isEmpty()) {
            return Uni.createFrom().failure(new IllegalArgumentException("New password is required"));
        }
        return tokenManagement
                .validate(token, TokenKind.RESET)
                .flatMap(claims -> changePassword(claims.subject(), newPassword).replaceWith(claims.subject()));
    }

    @Override
    public Uni<Void> changePassword(String principalId, String newPassword) {
        if (newPassword == null || newPassword.isEmpty()) {
            return Uni.createFrom().failure(new IllegalArgumentException("New password is required"));
        }
        return identityStore
                .updatePassword(principalId, newPassword)
                .flatMap(v -> tokenManagement.revokeAll(principalId))
                .invoke(epoch -> LOG.infof("Password changed for %s", principalId))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> logoutEverywhere(String principalId) {
        return tokenManagement.revokeAll(principalId).replaceWithVoid();
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
