package haven.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import haven.core.config.CacheStoreConfig;
import haven.core.port.out.CacheStore;
import haven.core.port.out.SecurityMetrics;
import haven.spi.CacheStoreProvider;

/**
 * Redis-based cache store provider.
 *
 * <p>This is the provider for production deployments. All instances share
 * the same denylist, epochs and leases.
 */
@ApplicationScoped
public class RedisCacheStoreProvider implements CacheStoreProvider {

    private static final Logger LOG = Logger.getLogger(RedisCacheStoreProvider.class);
    private static final int PRIORITY = 100;
    private static final Duration AVAILABILITY_CHECK_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(2);

    private final ReactiveRedisDataSource redisDataSource;
    private final CacheStoreConfig config;
    private final SecurityMetrics metrics;

    private RedisCacheStore store;
    private final AtomicBoolean available = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);
    private final AtomicBoolean checkStarted = new AtomicBoolean(false);

    @Inject
    public RedisCacheStoreProvider(
            ReactiveRedisDataSource redisDataSource, CacheStoreConfig config, SecurityMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.config = config;
        this.metrics = metrics;
    }

    @PostConstruct
    void init() {
        if (config.provider().map("redis"::equals).orElse(true)) {
            checkAvailability();
        }
    }

    private void checkAvailability() {
        if (!checkStarted.compareAndSet(false, true)) {
            return;
        }
        redisDataSource
                .execute("PING")
                .ifNoItem()
                .after(AVAILABILITY_CHECK_TIMEOUT)
                .fail()
                .subscribe()
                .with(
                        result -> {
                            available.set(true);
                            checkLatch.countDown();
                            LOG.info("Redis cache store is available");
                        },
                        error -> {
                            available.set(false);
                            checkLatch.countDown();
                            LOG.warnf("Redis cache store is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        checkAvailability();
        try {
            if (!checkLatch.await(AVAILABILITY_CHECK_TIMEOUT.toSeconds() + 1, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return available.get();
    }

    @Override
    public synchronized CacheStore createStore() {
        if (store == null) {
            store = new RedisCacheStore(redisDataSource, config.timeout(), metrics);
            LOG.infof("Created Redis cache store with key prefix: %s", config.keyPrefix());
        }
        return store;
    }

    /**
     * Ping Redis on every readiness request, so an outage after startup marks
     * the instance not ready and a recovery marks it ready again.
     */
    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var builder = HealthCheckResponse.named("cache-store-redis").withData("type", "redis");
        try {
            redisDataSource.execute("PING").ifNoItem().after(HEALTH_CHECK_TIMEOUT).fail().await().indefinitely();
        } catch (RuntimeException e) {
            if (available.getAndSet(false)) {
                LOG.warnf("Redis cache store became unavailable: %s", e.getMessage());
            }
            return Optional.of(builder.down().withData("error", String.valueOf(e.getMessage())).build());
        }
        if (!available.getAndSet(true)) {
            LOG.info("Redis cache store is available");
        }
        return Optional.of(builder.up().withData("keyPrefix", config.keyPrefix()).build());
    }
}
