package haven.adapter.out.identity;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import haven.core.config.CacheStoreConfig;
import haven.core.config.IdentityConfig;
import haven.core.exception.AuthenticationException;
import haven.core.model.auth.Principal;
import haven.core.port.out.CacheStore;
import haven.core.port.out.IdentityStore;
import haven.core.util.CacheKeys;

/**
 * Identity store backed by application configuration.
 *
 * <p>Principals, their domains and Argon2id password hashes come from
 * {@code haven.identity.*}. Password changes and token epochs are written to
 * the cache store, so they are shared between instances and survive restarts
 * of a single instance.
 */
@ApplicationScoped
public class ConfigIdentityStore implements IdentityStore {

    private static final Logger LOG = Logger.getLogger(ConfigIdentityStore.class);

    private final Map<String, StoredPrincipal> principalsById;
    private final Map<String, StoredPrincipal> principalsByUsername;
    private final Set<String> knownDomains;
    private final CacheStore store;
    private final CacheKeys keys;
    private final Argon2PasswordHasher hasher;

    @Inject
    public ConfigIdentityStore(
            IdentityConfig config, CacheStore store, CacheStoreConfig storeConfig, Argon2PasswordHasher hasher) {
        this(config, store, new CacheKeys(storeConfig.keyPrefix()), hasher);
    }

    public ConfigIdentityStore(IdentityConfig config, CacheStore store, CacheKeys keys, Argon2PasswordHasher hasher) {
        this.store = store;
        this.keys = keys;
        this.hasher = hasher;
        this.principalsById = new LinkedHashMap<>();
        this.principalsByUsername = new LinkedHashMap<>();
        final var domains = new HashSet<>(config.domains().orElse(Set.of()));

        config.users().forEach((id, user) -> {
            final var principal = new Principal(
                    id,
                    user.username(),
                    user.domains().orElse(Set.of()),
                    user.permissions().orElse(Set.of()));
            final var stored = new StoredPrincipal(principal, user.passwordHash());
            principalsById.put(id, stored);
            if (principalsByUsername.putIfAbsent(user.username(), stored) != null) {
                throw new IllegalStateException("Duplicate username in identity configuration: " + user.username());
            }
            domains.addAll(principal.domains());
        });

        this.knownDomains = Set.copyOf(domains);
        LOG.infof("Loaded %d principals across %d domains", principalsById.size(), knownDomains.size());
    }

    @Override
    public Uni<Optional<Principal>> verifyCredentials(String username, String password) {
        final var stored = principalsByUsername.get(username);
        if (stored == null) {
            return Uni.createFrom().item(Optional.empty());
        }
        return currentPasswordHash(stored)
                .emitOn(Infrastructure.getDefaultWorkerPool())
                .map(hash -> hasher.verify(password, hash)
                        ? Optional.of(stored.principal())
                        : Optional.<Principal>empty());
    }

    @Override
    public Uni<Optional<Principal>> findById(String principalId) {
        return Uni.createFrom()
                .item(Optional.ofNullable(principalsById.get(principalId)).map(StoredPrincipal::principal));
    }

    @Override
    public Uni<Optional<Principal>> findByUsername(String username) {
        return Uni.createFrom()
                .item(Optional.ofNullable(principalsByUsername.get(username)).map(StoredPrincipal::principal));
    }

    @Override
    public Set<String> authorizedDomains(Principal principal) {
        return principal.domains();
    }

    @Override
    public boolean isKnownDomain(String domain) {
        return domain != null && knownDomains.contains(domain);
    }

    @Override
    public Uni<Long> currentEpoch(String principalId) {
        return store.get(keys.epoch(principalId)).map(value -> value.map(Long::parseLong).orElse(0L));
    }

    @Override
    public Uni<Long> bumpEpoch(String principalId) {
        return store.increment(keys.epoch(principalId));
    }

    @Override
    public Uni<Void> updatePassword(String principalId, String newPassword) {
        if (!principalsById.containsKey(principalId)) {
            return Uni.createFrom().failure(AuthenticationException.badCredentials());
        }
        return Uni.createFrom()
                .item(() -> hasher.hash(newPassword))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .flatMap(hash -> store.put(keys.password(principalId), hash))
                .invoke(() -> LOG.debugf("Stored new password hash for %s", principalId));
    }

    private Uni<String> currentPasswordHash(StoredPrincipal stored) {
        return store.get(keys.password(stored.principal().id()))
                .map(override -> override.orElse(stored.configuredHash()));
    }

    private record StoredPrincipal(Principal principal, String configuredHash) {}
}
