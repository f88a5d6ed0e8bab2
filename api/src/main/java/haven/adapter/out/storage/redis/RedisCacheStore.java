package haven.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import haven.core.port.out.CacheStore;
import haven.core.port.out.SecurityMetrics;

/**
 * Redis implementation of the cache store.
 *
 * <p>Single-key atomicity comes from Redis itself: {@code SET NX PX} for
 * set-if-absent, {@code INCR} for counters and Lua scripts for the
 * compare-and-set and compare-and-delete operations.
 */
public class RedisCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(RedisCacheStore.class);

    static final String COMPARE_AND_SET_SCRIPT =
            "if redis.call('GET', KEYS[1]) == ARGV[1] then "
                    + "redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3]) return 1 "
                    + "else return 0 end";

    static final String COMPARE_AND_DELETE_SCRIPT =
            "if redis.call('GET', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('DEL', KEYS[1]) "
                    + "else return 0 end";

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisCacheStore(ReactiveRedisDataSource redisDataSource, Duration timeout, SecurityMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = new RedisTimeoutHelper(timeout, metrics, "redis-cache-store");
    }

    @Override
    public Uni<Boolean> setIfAbsent(String key, String value, Duration ttl) {
        var operation = redisDataSource
                .execute("SET", key, value, "NX", "PX", String.valueOf(requirePositive(ttl)))
                .map(response -> response != null);
        return timeoutHelper.withTimeout(operation, "setIfAbsent").invoke(written -> {
            if (!written) {
                LOG.debugf("Key already present: %s", key);
            }
        });
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return timeoutHelper.withTimeout(valueCommands.get(key).map(Optional::ofNullable), "get");
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return timeoutHelper.withTimeout(keyCommands.del(key).map(removed -> removed > 0), "delete");
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        return timeoutHelper.withTimeout(valueCommands.psetex(key, requirePositive(ttl), value), "set");
    }

    @Override
    public Uni<Void> put(String key, String value) {
        return timeoutHelper.withTimeout(valueCommands.set(key, value), "put");
    }

    @Override
    public Uni<Long> increment(String key) {
        return timeoutHelper.withTimeout(valueCommands.incr(key), "increment");
    }

    @Override
    public Uni<Boolean> compareAndSet(String key, String expected, String value, Duration ttl) {
        var operation = redisDataSource
                .execute(
                        "EVAL",
                        COMPARE_AND_SET_SCRIPT,
                        "1",
                        key,
                        expected,
                        value,
                        String.valueOf(requirePositive(ttl)))
                .map(response -> response != null && response.toLong() == 1L);
        return timeoutHelper.withTimeout(operation, "compareAndSet");
    }

    @Override
    public Uni<Boolean> compareAndDelete(String key, String expected) {
        var operation = redisDataSource
                .execute("EVAL", COMPARE_AND_DELETE_SCRIPT, "1", key, expected)
                .map(response -> response != null && response.toLong() == 1L);
        return timeoutHelper.withTimeout(operation, "compareAndDelete");
    }

    private static long requirePositive(Duration ttl) {
        if (ttl == null || ttl.toMillis() <= 0) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        return ttl.toMillis();
    }
}
