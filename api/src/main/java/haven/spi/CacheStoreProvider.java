package haven.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import haven.core.port.out.CacheStore;

/**
 * SPI for cache store backends.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage</li>
 *   <li>memory (priority: 0) - In-memory storage (development only)</li>
 * </ul>
 *
 * <p>The configured provider (haven.cache-store.provider) is used whether or
 * not it is currently available; without one, the highest priority available
 * provider is chosen.
 */
public interface CacheStoreProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the cache store implementation.
     *
     * @return Cache store instance
     */
    CacheStore createStore();

    /**
     * Report the status of the backend for the readiness endpoint. Called on
     * every readiness request, so it reflects the backend's current state.
     *
     * @return Health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
