package haven.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import haven.core.config.CacheStoreConfig;
import haven.core.port.out.CacheStore;
import haven.core.util.CacheKeys;

/**
 * Maintains the nonce denylist.
 *
 * <p>Each entry lives exactly as long as the token it guards. A token that has
 * already expired is never written, since expiry alone rejects it.
 */
@ApplicationScoped
public class TokenRevocationService {

    private static final Logger LOG = Logger.getLogger(TokenRevocationService.class);
    private static final String REVOKED_MARKER = "1";

    private final CacheStore store;
    private final CacheKeys keys;
    private final Clock clock;

    @Inject
    public TokenRevocationService(CacheStore store, CacheStoreConfig storeConfig, Clock clock) {
        this(store, new CacheKeys(storeConfig.keyPrefix()), clock);
    }

    public TokenRevocationService(CacheStore store, CacheKeys keys, Clock clock) {
        this.store = store;
        this.keys = keys;
        this.clock = clock;
    }

    /**
     * Check if a nonce is on the denylist.
     *
     * @param nonce the token nonce
     * @return Uni with true if revoked
     */
    public Uni<Boolean> isRevoked(String nonce) {
        return store.get(keys.revoked(nonce)).map(entry -> entry.isPresent());
    }

    /**
     * Put a nonce on the denylist until the token's own expiry.
     *
     * <p>Idempotent: revoking twice leaves a single entry.
     *
     * @param nonce     the token nonce
     * @param expiresAt the token's expiry
     * @return Uni completing when the entry is stored
     */
    public Uni<Void> revoke(String nonce, Instant expiresAt) {
        final var ttl = remaining(expiresAt);
        if (ttl.isZero()) {
            LOG.debugf("Skipping revocation of already expired nonce %s", nonce);
            return Uni.createFrom().voidItem();
        }
        return store.set(keys.revoked(nonce), REVOKED_MARKER, ttl)
                .invoke(() -> LOG.debugf("Revoked nonce %s for %s", nonce, ttl));
    }

    /**
     * Atomically check and revoke a nonce in one step.
     *
     * <p>Exactly one of any number of concurrent callers for the same nonce
     * gets {@code true}.
     *
     * @param nonce     the token nonce
     * @param expiresAt the token's expiry
     * @return Uni with true if this call consumed the nonce, false if it was
     *         already revoked or the token has expired
     */
    public Uni<Boolean> consume(String nonce, Instant expiresAt) {
        final var ttl = remaining(expiresAt);
        if (ttl.isZero()) {
            return Uni.createFrom().item(false);
        }
        return store.setIfAbsent(keys.revoked(nonce), REVOKED_MARKER, ttl).invoke(consumed -> {
            if (consumed) {
                LOG.debugf("Consumed nonce %s", nonce);
            } else {
                LOG.debugf("Nonce %s was already used or revoked", nonce);
            }
        });
    }

    private Duration remaining(Instant expiresAt) {
        final var ttl = Duration.between(clock.instant(), expiresAt);
        return ttl.toMillis() <= 0 ? Duration.ZERO : ttl;
    }
}
