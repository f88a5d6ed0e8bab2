package haven.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the shared cache store.
 *
 * <p>Configuration prefix: {@code haven.cache-store}
 */
@ConfigMapping(prefix = "haven.cache-store")
public interface CacheStoreConfig {

    /**
     * Name of the provider to use ({@code redis} or {@code memory}).
     *
     * <p>When empty, the highest priority available provider is selected.
     */
    Optional<String> provider();

    /**
     * Prefix applied to every key written by this subsystem.
     *
     * @return key prefix (default: haven:)
     */
    @WithDefault("haven:")
    String keyPrefix();

    /**
     * Upper bound on each remote store call.
     *
     * @return timeout (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration timeout();
}
