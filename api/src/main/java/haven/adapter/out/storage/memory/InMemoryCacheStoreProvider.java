package haven.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import haven.core.port.out.CacheStore;
import haven.spi.CacheStoreProvider;

/**
 * In-memory cache store provider.
 *
 * <p>Always available. Used when configured, or when no provider is configured
 * and nothing with a higher priority is available.
 *
 * <p><strong>Warning:</strong> state is per process, so revocations and
 * leases are not shared between instances. Not for production.
 */
@ApplicationScoped
public class InMemoryCacheStoreProvider implements CacheStoreProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryCacheStoreProvider.class);
    private static final int PRIORITY = 0;

    private final Clock clock;
    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private InMemoryCacheStore store;

    @Inject
    public InMemoryCacheStoreProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized CacheStore createStore() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Cache store is in-memory only!");
            LOG.warn("  Token revocations and record leases are NOT shared between instances.");
            LOG.warn("  Configure Redis (haven.cache-store.provider=redis) for production.");
            LOG.warn("========================================================================");
        }

        if (store == null) {
            store = new InMemoryCacheStore(clock);
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("cache-store-memory")
                .up()
                .withData("type", "in-memory")
                .withData("entries", store != null ? store.size() : 0)
                .build());
    }

    @PreDestroy
    synchronized void shutdown() {
        if (store != null) {
            store.shutdown();
        }
    }
}
