package haven.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import haven.core.exception.AuthenticationException;
import haven.core.model.auth.Principal;
import haven.core.model.auth.TokenPair;
import haven.core.port.in.DomainAuthentication;
import haven.core.port.in.TokenManagement;
import haven.core.port.out.IdentityStore;
import haven.core.port.out.SecurityMetrics;

/**
 * Password grant with a domain selector.
 *
 * <p>A principal that belongs to exactly one domain may omit it; anyone else
 * must name the domain to log into. The resolved domain is bound into both
 * tokens of the issued pair.
 */
@ApplicationScoped
public class DomainAuthenticationService implements DomainAuthentication {

    private static final Logger LOG = Logger.getLogger(DomainAuthenticationService.class);

    private final IdentityStore identityStore;
    private final TokenManagement tokenManagement;
    private final SecurityMetrics metrics;

    @Inject
    public DomainAuthenticationService(
            IdentityStore identityStore, TokenManagement tokenManagement, SecurityMetrics metrics) {
        this.identityStore = identityStore;
        this.tokenManagement = tokenManagement;
        this.metrics = metrics;
    }

    @Override
    public Uni<TokenPair> authenticate(String username, String password, String requestedDomain) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            metrics.recordAuthentication(false);
            return Uni.createFrom().failure(AuthenticationException.badCredentials());
        }

        return identityStore
                .verifyCredentials(username, password)
                .flatMap(found -> {
                    final var principal = found.orElseThrow(AuthenticationException::badCredentials);
                    final var domain = resolveDomain(principal, requestedDomain);
                    return tokenManagement.issuePair(principal.id(), domain, principal.permissions());
                })
                .invoke(pair -> {
                    metrics.recordAuthentication(true);
                    LOG.infof("Authenticated %s into domain %s", username, pair.domain());
                })
                .onFailure(AuthenticationException.class)
                .invoke(error -> {
                    metrics.recordAuthentication(false);
                    LOG.debugf("Authentication of %s failed: %s", username, error.getMessage());
                });
    }

    private String resolveDomain(Principal principal, String requestedDomain) {
        final var authorized = identityStore.authorizedDomains(principal);

        if (requestedDomain == null || requestedDomain.isBlank()) {
            if (authorized.size() == 1) {
                return authorized.iterator().next();
            }
            throw AuthenticationException.domainNotAuthorized(null);
        }

        if (!identityStore.isKnownDomain(requestedDomain)) {
            throw AuthenticationException.unknownDomain(requestedDomain);
        }
        if (!authorized.contains(requestedDomain)) {
            throw AuthenticationException.domainNotAuthorized(requestedDomain);
        }
        return requestedDomain;
    }
}
