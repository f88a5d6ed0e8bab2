package haven.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import haven.core.service.storage.CacheStoreProviderRegistry;

/**
 * Readiness check for the selected cache store.
 *
 * <p>Token validation and record leases cannot answer without the store, so
 * a DOWN store marks the instance not ready.
 */
@Readiness
@ApplicationScoped
public class CacheStoreHealthCheck implements HealthCheck {

    private final CacheStoreProviderRegistry registry;

    @Inject
    public CacheStoreHealthCheck(CacheStoreProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        final var provider = registry.getSelectedProvider();
        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.named("cache-store-" + provider.name())
                        .up()
                        .withData("type", provider.name())
                        .build());
    }
}
