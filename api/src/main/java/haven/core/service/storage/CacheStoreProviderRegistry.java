package haven.core.service.storage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import haven.core.config.CacheStoreConfig;
import haven.core.port.out.CacheStore;
import haven.spi.CacheStoreProvider;

/**
 * Registry for cache store providers.
 *
 * <p>Discovers providers via CDI and selects one based on configuration and
 * availability.
 *
 * <p>A configured provider (haven.cache-store.provider) is always used, even
 * while its backend is down: operations then fail with
 * {@code StoreUnavailableException} and readiness reports DOWN, rather than
 * revocations and leases silently moving to per-process memory. Only without
 * a configured provider is the highest priority available one chosen.
 */
@ApplicationScoped
public class CacheStoreProviderRegistry {

    private static final Logger LOG = Logger.getLogger(CacheStoreProviderRegistry.class);

    private final Instance<CacheStoreProvider> providers;
    private final CacheStoreConfig config;

    private volatile CacheStoreProvider selectedProvider;
    private volatile CacheStore store;

    @Inject
    public CacheStoreProviderRegistry(Instance<CacheStoreProvider> providers, CacheStoreConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider during startup, off the event loop, since Redis
     * availability checks block.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Cache store provider initialized: %s", selectedProvider.name());
    }

    /**
     * Get the cache store from the selected provider.
     *
     * @return Cache store instance
     */
    public synchronized CacheStore getStore() {
        if (store == null) {
            store = getSelectedProvider().createStore();
        }
        return store;
    }

    /**
     * Get the selected provider.
     *
     * @return Selected provider
     */
    public synchronized CacheStoreProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private CacheStoreProvider selectProvider() {
        Optional<String> configuredProvider = config.provider();

        // Check the configured provider first so unused backends are never contacted
        if (configuredProvider.isPresent()) {
            String name = configuredProvider.get();
            CacheStoreProvider configured = providers.stream()
                    .filter(p -> p.name().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("Unknown cache store provider: " + name));
            if (configured.isAvailable()) {
                LOG.infof("Using configured cache store provider: %s", name);
            } else {
                LOG.warnf("Configured cache store provider '%s' is not available yet; "
                        + "cache operations fail until it recovers", name);
            }
            return configured;
        }

        List<CacheStoreProvider> availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(CacheStoreProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available cache store providers: %s",
                availableProviders.stream().map(CacheStoreProvider::name).toList());

        if (!availableProviders.isEmpty()) {
            CacheStoreProvider provider = availableProviders.get(0);
            LOG.infof("Using cache store provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No cache store providers available");
    }

    /**
     * Get all available providers.
     *
     * @return List of available providers
     */
    public List<CacheStoreProvider> getAvailableProviders() {
        return providers.stream().filter(CacheStoreProvider::isAvailable).toList();
    }
}
