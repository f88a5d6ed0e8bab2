package haven.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import haven.core.port.out.CacheStore;
import haven.core.service.storage.CacheStoreProviderRegistry;

/**
 * CDI producer for the cache store.
 *
 * <p>Delegates to the {@link CacheStoreProviderRegistry}, which selects the
 * provider based on configuration and availability.
 *
 * @see haven.spi.CacheStoreProvider
 */
@ApplicationScoped
public class CacheStoreProducer {

    private final CacheStoreProviderRegistry registry;

    @Inject
    public CacheStoreProducer(CacheStoreProviderRegistry registry) {
        this.registry = registry;
    }

    /**
     * Produces the cache store of the selected provider.
     *
     * @return cache store from the registry-selected provider
     */
    @Produces
    @ApplicationScoped
    public CacheStore cacheStore() {
        return registry.getStore();
    }
}
