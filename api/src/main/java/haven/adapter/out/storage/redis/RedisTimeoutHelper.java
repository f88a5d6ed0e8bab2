package haven.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import haven.core.exception.StoreUnavailableException;
import haven.core.port.out.SecurityMetrics;

/**
 * Applies timeouts and failure translation to Redis operations.
 *
 * <p>Every operation is fail-fast: timeouts and connection or server failures
 * become {@link StoreUnavailableException}. A missing answer is never read as
 * "not revoked" or "not locked".
 *
 * <h2>Metrics</h2>
 * Records timeouts and non-timeout failures separately through
 * {@link SecurityMetrics}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final SecurityMetrics metrics;
    private final String storeName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout   the timeout duration for Redis operations
     * @param metrics   metrics for recording timeouts (may be null)
     * @param storeName the store name for logging and metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, SecurityMetrics metrics, String storeName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.storeName = storeName;
    }

    /**
     * Apply the timeout and translate every failure into
     * {@link StoreUnavailableException}.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param <T>           the result type
     * @return a Uni that fails with StoreUnavailableException on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .fail()
                .onFailure()
                .transform(error -> {
                    if (error instanceof StoreUnavailableException) {
                        return error;
                    }
                    if (error instanceof TimeoutException) {
                        LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, storeName, timeout);
                        recordTimeout(operationName);
                        return new StoreUnavailableException(
                                operationName, "Redis operation timed out: " + operationName, error);
                    }
                    LOG.warnv(
                            "Redis operation failure: {0} in {1}: {2}", operationName, storeName, error.getMessage());
                    recordFailure(operationName);
                    return new StoreUnavailableException(
                            operationName, "Redis operation failed: " + operationName, error);
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(storeName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(storeName, operationName);
        }
    }
}
