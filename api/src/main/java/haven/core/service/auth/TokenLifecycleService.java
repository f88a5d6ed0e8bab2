package haven.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import haven.core.config.TokenConfig;
import haven.core.exception.TokenException;
import haven.core.model.auth.IssuedToken;
import haven.core.model.auth.TokenClaims;
import haven.core.model.auth.TokenKind;
import haven.core.model.auth.TokenPair;
import haven.core.port.in.TokenManagement;
import haven.core.port.out.IdentityStore;
import haven.core.port.out.SecurityMetrics;
import haven.core.port.out.TokenCodec;

/**
 * Issues, validates, rotates and revokes bearer tokens.
 *
 * <p>Tokens themselves are stored nowhere. Validation runs, in order: decode
 * and signature, kind, expiry, epoch, denylist. Single-use kinds are consumed
 * by an atomic set-if-absent on their denylist entry, so a second use always
 * fails with REVOKED.
 */
@ApplicationScoped
public class TokenLifecycleService implements TokenManagement {

    private static final Logger LOG = Logger.getLogger(TokenLifecycleService.class);

    private final TokenCodec codec;
    private final TokenRevocationService revocationService;
    private final IdentityStore identityStore;
    private final TokenConfig config;
    private final NonceGenerator nonceGenerator;
    private final Clock clock;
    private final SecurityMetrics metrics;

    @Inject
    public TokenLifecycleService(
            TokenCodec codec,
            TokenRevocationService revocationService,
            IdentityStore identityStore,
            TokenConfig config,
            NonceGenerator nonceGenerator,
            Clock clock,
            SecurityMetrics metrics) {
        this.codec = codec;
        this.revocationService = revocationService;
        this.identityStore = identityStore;
        this.config = config;
        this.nonceGenerator = nonceGenerator;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public Uni<IssuedToken> issue(
            String subject, String domain, TokenKind kind, Duration customDuration, Map<String, Object> attributes) {
        final var ttl = customDuration != null ? customDuration : defaultTtl(kind);
        if (ttl.isNegative() || ttl.isZero()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Token lifetime must be positive"));
        }

        return identityStore.currentEpoch(subject).map(epoch -> {
            final var issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            final var claims = new TokenClaims(
                    subject,
                    domain,
                    kind,
                    issuedAt,
                    issuedAt.plus(ttl).truncatedTo(ChronoUnit.SECONDS),
                    nonceGenerator.generate(),
                    epoch,
                    attributes);
            final var token = codec.encode(claims);
            metrics.recordTokenIssued(kind);
            LOG.debugf("Issued %s token for %s (nonce %s)", kind.claimValue(), subject, claims.nonce());
            return new IssuedToken(token, claims);
        });
    }

    @Override
    public Uni<TokenPair> issuePair(String principalId, String domain, Set<String> permissions) {
        final var permissionList = new ArrayList<>(permissions == null ? Set.<String>of() : permissions);
        permissionList.sort(null);

        return issue(principalId, domain, TokenKind.REFRESH, null, Map.of(TokenClaims.PERMISSIONS, permissionList))
                .flatMap(refresh -> {
                    final var accessAttributes = new HashMap<String, Object>();
                    accessAttributes.put(TokenClaims.REFRESH_ID, refresh.claims().nonce());
                    accessAttributes.put(
                            TokenClaims.REFRESH_EXPIRES_AT,
                            refresh.claims().expiresAt().getEpochSecond());
                    accessAttributes.put(TokenClaims.PERMISSIONS, permissionList);
                    return issue(principalId, domain, TokenKind.ACCESS, null, accessAttributes)
                            .map(access -> new TokenPair(access, refresh));
                });
    }

    @Override
    public Uni<TokenClaims> validate(String token, TokenKind expectedKind) {
        return check(token, expectedKind, expectedKind.singleUse());
    }

    @Override
    public Uni<TokenClaims> inspect(String token, TokenKind expectedKind) {
        return check(token, expectedKind, false);
    }

    @Override
    public Uni<TokenPair> refresh(String refreshToken) {
        return check(refreshToken, TokenKind.REFRESH, true)
                .flatMap(claims -> identityStore.findById(claims.subject()).map(principal -> {
                    final var current = principal.orElseThrow(
                            () -> TokenException.revoked("principal no longer exists"));
                    if (claims.domain() != null && !identityStore.authorizedDomains(current).contains(claims.domain())) {
                        throw TokenException.revoked("principal no longer authorized for " + claims.domain());
                    }
                    return current;
                }).flatMap(principal -> issuePair(principal.id(), claims.domain(), principal.permissions())))
                .invoke(pair -> LOG.debugf("Rotated refresh token for %s", pair.access().claims().subject()));
    }

    @Override
    public Uni<Void> revoke(String token) {
        return Uni.createFrom()
                .item(() -> codec.decode(token))
                .flatMap(claims -> revocationService.revoke(claims.nonce(), claims.expiresAt()))
                .invoke(() -> metrics.recordRevocation("token"));
    }

    @Override
    public Uni<Void> logout(String accessToken) {
        return signedAccessClaims(accessToken).flatMap(claims -> {
            final var revokeAccess = revocationService.revoke(claims.nonce(), claims.expiresAt());
            final var refreshId = claims.attribute(TokenClaims.REFRESH_ID);
            final var refreshExpiry = claims.attribute(TokenClaims.REFRESH_EXPIRES_AT);
            final Uni<Void> revokeBoth;
            if (refreshId.isEmpty() || refreshExpiry.isEmpty()) {
                revokeBoth = revokeAccess;
            } else {
                final Instant refreshExpiresAt;
                try {
                    refreshExpiresAt = Instant.ofEpochSecond(Long.parseLong(refreshExpiry.get()));
                } catch (NumberFormatException e) {
                    return Uni.createFrom().failure(TokenException.malformed("paired refresh expiry", e));
                }
                revokeBoth = revokeAccess.flatMap(v -> revocationService.revoke(refreshId.get(), refreshExpiresAt));
            }
            return revokeBoth.invoke(() -> {
                metrics.recordRevocation("token");
                LOG.infof("Logged out %s", claims.subject());
            });
        });
    }

    @Override
    public Uni<Long> revokeAll(String principalId) {
        return identityStore.bumpEpoch(principalId).invoke(epoch -> {
            metrics.recordRevocation("principal");
            LOG.infof("Revoked all tokens of %s (epoch now %d)", principalId, epoch);
        });
    }

    /**
     * Signature and kind only. An expired access token can still log out the
     * refresh token paired with it.
     */
    private Uni<TokenClaims> signedAccessClaims(String token) {
        return Uni.createFrom()
                .item(() -> {
                    final var claims = codec.decode(token);
                    if (claims.kind() != TokenKind.ACCESS) {
                        throw TokenException.wrongKind(TokenKind.ACCESS, claims.kind());
                    }
                    return claims;
                })
                .onFailure(TokenException.class)
                .invoke(error -> metrics.recordTokenRejected(((TokenException) error).kind()));
    }

    private Uni<TokenClaims> check(String token, TokenKind expectedKind, boolean consume) {
        return Uni.createFrom()
                .item(() -> {
                    final var claims = codec.decode(token);
                    if (claims.kind() != expectedKind) {
                        throw TokenException.wrongKind(expectedKind, claims.kind());
                    }
                    if (claims.isExpiredAt(clock.instant())) {
                        throw TokenException.expired();
                    }
                    return claims;
                })
                .flatMap(claims -> identityStore.currentEpoch(claims.subject()).map(currentEpoch -> {
                    if (claims.epoch() < currentEpoch) {
                        throw TokenException.revoked("superseded by a later logout or password change");
                    }
                    return claims;
                }))
                .flatMap(claims -> consume ? consumeOnce(claims) : rejectIfRevoked(claims))
                .onFailure(TokenException.class)
                .invoke(error -> metrics.recordTokenRejected(((TokenException) error).kind()));
    }

    private Uni<TokenClaims> consumeOnce(TokenClaims claims) {
        return revocationService.consume(claims.nonce(), claims.expiresAt()).map(consumed -> {
            if (!consumed) {
                throw TokenException.revoked("already used");
            }
            return claims;
        });
    }

    private Uni<TokenClaims> rejectIfRevoked(TokenClaims claims) {
        return revocationService.isRevoked(claims.nonce()).map(revoked -> {
            if (revoked) {
                throw TokenException.revoked();
            }
            return claims;
        });
    }

    private Duration defaultTtl(TokenKind kind) {
        return switch (kind) {
            case ACCESS -> config.accessTtl();
            case REFRESH -> config.refreshTtl();
            case INVITATION -> config.invitationTtl();
            case RESET -> config.resetTtl();
        };
    }
}
