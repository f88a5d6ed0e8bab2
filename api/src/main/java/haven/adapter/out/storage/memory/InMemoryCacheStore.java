package haven.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import haven.core.port.out.CacheStore;

/**
 * In-memory implementation of the cache store.
 *
 * <p>This implementation is intended for development and testing only.
 * Entries are lost on restart and not shared across instances.
 *
 * <p>Every operation is a single {@link ConcurrentMap#compute} so it is atomic
 * for its key. Expiry is evaluated against the supplied {@link Clock}; a
 * background task drops expired entries every minute.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCacheStore.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "cache-store-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory cache store");
    }

    @Override
    public Uni<Boolean> setIfAbsent(String key, String value, Duration ttl) {
        final var expiresAt = expiryFor(ttl);
        return Uni.createFrom().item(() -> {
            final var written = new AtomicBoolean(false);
            entries.compute(key, (k, existing) -> {
                if (isLive(existing)) {
                    return existing;
                }
                written.set(true);
                return new Entry(value, expiresAt);
            });
            return written.get();
        });
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = entries.get(key);
            return isLive(entry) ? Optional.of(entry.value()) : Optional.<String>empty();
        });
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> {
            final var removed = entries.remove(key);
            return isLive(removed);
        });
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        final var expiresAt = expiryFor(ttl);
        return Uni.createFrom().item(() -> {
            entries.put(key, new Entry(value, expiresAt));
            return null;
        });
    }

    @Override
    public Uni<Void> put(String key, String value) {
        return Uni.createFrom().item(() -> {
            entries.put(key, new Entry(value, null));
            return null;
        });
    }

    @Override
    public Uni<Long> increment(String key) {
        return Uni.createFrom().item(() -> {
            final var updated = entries.compute(key, (k, existing) -> {
                long current = isLive(existing) ? parseCounter(k, existing.value()) : 0L;
                return new Entry(Long.toString(current + 1), null);
            });
            return Long.parseLong(updated.value());
        });
    }

    @Override
    public Uni<Boolean> compareAndSet(String key, String expected, String value, Duration ttl) {
        final var expiresAt = expiryFor(ttl);
        return Uni.createFrom().item(() -> {
            final var replaced = new AtomicBoolean(false);
            entries.computeIfPresent(key, (k, existing) -> {
                if (!isLive(existing)) {
                    return null;
                }
                if (!existing.value().equals(expected)) {
                    return existing;
                }
                replaced.set(true);
                return new Entry(value, expiresAt);
            });
            return replaced.get();
        });
    }

    @Override
    public Uni<Boolean> compareAndDelete(String key, String expected) {
        return Uni.createFrom().item(() -> {
            final var deleted = new AtomicBoolean(false);
            entries.computeIfPresent(key, (k, existing) -> {
                if (!isLive(existing)) {
                    return null;
                }
                if (!existing.value().equals(expected)) {
                    return existing;
                }
                deleted.set(true);
                return null;
            });
            return deleted.get();
        });
    }

    private Instant expiryFor(Duration ttl) {
        if (ttl == null || ttl.toMillis() <= 0) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        return clock.instant().plus(ttl);
    }

    private boolean isLive(Entry entry) {
        return entry != null && (entry.expiresAt() == null || entry.expiresAt().isAfter(clock.instant()));
    }

    private static long parseCounter(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Value at " + key + " is not a counter", e);
        }
    }

    void cleanupExpired() {
        final var before = entries.size();

        entries.entrySet().removeIf(entry -> !isLive(entry.getValue()));

        final var removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired cache store entries", removed);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Number of stored entries, including expired ones not yet cleaned up.
     */
    public int size() {
        return entries.size();
    }

    private record Entry(String value, Instant expiresAt) {}
}
