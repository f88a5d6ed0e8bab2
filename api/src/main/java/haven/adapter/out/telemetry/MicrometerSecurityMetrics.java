package haven.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import haven.core.config.TelemetryConfig;
import haven.core.exception.FailureKind;
import haven.core.model.auth.TokenKind;
import haven.core.port.out.SecurityMetrics;

/**
 * Records security-state metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, so callers never need
 * to check configuration.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code haven.tokens.issued.total} - Issued tokens by kind</li>
 *   <li>{@code haven.tokens.rejected.total} - Rejected tokens by failure kind</li>
 *   <li>{@code haven.tokens.revocations.total} - Revocations by scope</li>
 *   <li>{@code haven.auth.logins.total} - Login attempts by outcome</li>
 *   <li>{@code haven.leases.operations.total} - Lease operations by outcome</li>
 *   <li>{@code haven.cache_store.timeouts.total} - Cache store timeouts</li>
 *   <li>{@code haven.cache_store.failures.total} - Cache store failures</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerSecurityMetrics implements SecurityMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerSecurityMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordTokenIssued(TokenKind kind) {
        if (!enabled) {
            return;
        }

        Counter.builder("haven.tokens.issued.total")
                .description("Tokens issued")
                .tag("kind", kind.claimValue())
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokenRejected(FailureKind reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("haven.tokens.rejected.total")
                .description("Tokens that failed validation")
                .tag("reason", reason.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordRevocation(String scope) {
        if (!enabled) {
            return;
        }

        Counter.builder("haven.tokens.revocations.total")
                .description("Token revocations")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuthentication(boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("haven.auth.logins.total")
                .description("Password grant attempts")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordLeaseOperation(String operation, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("haven.leases.operations.total")
                .description("Record lease operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreTimeout(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("haven.cache_store.timeouts.total")
                .description("Cache store operations that timed out")
                .tag("store", store)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("haven.cache_store.failures.total")
                .description("Cache store operations that failed")
                .tag("store", store)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
