package haven.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port for the shared key-value store that holds all expiry-driven security
 * state (denylist entries, epochs, edit leases).
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Entries written with a TTL MUST disappear once it elapses</li>
 *   <li>Each operation MUST be atomic with respect to its single key</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 *   <li>Timeouts and connection failures MUST surface as
 *       {@link haven.core.exception.StoreUnavailableException}</li>
 * </ul>
 *
 * <p>TTL arguments must be positive.
 *
 * @see haven.spi.CacheStoreProvider
 */
public interface CacheStore {

    /**
     * Write the value only if the key is absent.
     *
     * @param key   the key
     * @param value the value
     * @param ttl   time to live
     * @return Uni with true if the value was written, false if the key already existed
     */
    Uni<Boolean> setIfAbsent(String key, String value, Duration ttl);

    /**
     * Read a value.
     *
     * @param key the key
     * @return Uni with the value, or empty if absent or expired
     */
    Uni<Optional<String>> get(String key);

    /**
     * Delete a key.
     *
     * @param key the key
     * @return Uni with true if a live entry was removed
     */
    Uni<Boolean> delete(String key);

    /**
     * Unconditionally write a value with a TTL.
     *
     * @param key   the key
     * @param value the value
     * @param ttl   time to live
     * @return Uni completing when written
     */
    Uni<Void> set(String key, String value, Duration ttl);

    /**
     * Unconditionally write a value that never expires.
     *
     * @param key   the key
     * @param value the value
     * @return Uni completing when written
     */
    Uni<Void> put(String key, String value);

    /**
     * Atomically increment a counter. An absent counter starts at 0, so the
     * first increment yields 1. Counters never expire.
     *
     * @param key the counter key
     * @return Uni with the incremented value
     */
    Uni<Long> increment(String key);

    /**
     * Replace the value only if it currently equals {@code expected}.
     *
     * @param key      the key
     * @param expected the value the caller observed
     * @param value    the replacement
     * @param ttl      time to live of the replacement
     * @return Uni with true if replaced
     */
    Uni<Boolean> compareAndSet(String key, String expected, String value, Duration ttl);

    /**
     * Delete the key only if its value currently equals {@code expected}.
     *
     * @param key      the key
     * @param expected the value the caller observed
     * @return Uni with true if deleted
     */
    Uni<Boolean> compareAndDelete(String key, String expected);
}
