package haven.core.service.lease;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import haven.core.config.CacheStoreConfig;
import haven.core.config.LeaseConfig;
import haven.core.exception.LeaseException;
import haven.core.exception.SecurityStateException;
import haven.core.exception.StoreUnavailableException;
import haven.core.model.lease.EditLease;
import haven.core.model.lease.LeaseStatus;
import haven.core.model.lease.LeaseTarget;
import haven.core.model.lease.RecordLeases;
import haven.core.port.in.LeaseManagement;
import haven.core.port.out.CacheStore;
import haven.core.port.out.SecurityMetrics;
import haven.core.util.CacheKeys;

/**
 * Exclusive, time-bounded edit leases on CRM records and record sections.
 *
 * <p>All leases of a record live in one cache entry whose TTL follows the
 * latest lease expiry. Every change reads the entry, decides against the
 * leases still live, and writes back with set-if-absent (no entry yet),
 * compare-and-set or compare-and-delete against the value read. A write that
 * loses to a concurrent one is decided again from the fresh value, so a
 * whole-record lease and a section lease of another principal can never both
 * be granted.
 */
@ApplicationScoped
public class RecordLeaseService implements LeaseManagement {

    private static final Logger LOG = Logger.getLogger(RecordLeaseService.class);
    private static final int MAX_ATTEMPTS = 3;

    private final CacheStore store;
    private final CacheKeys keys;
    private final Duration leaseDuration;
    private final Clock clock;
    private final SecurityMetrics metrics;

    @Inject
    public RecordLeaseService(
            CacheStore store,
            CacheStoreConfig storeConfig,
            LeaseConfig leaseConfig,
            Clock clock,
            SecurityMetrics metrics) {
        this(store, new CacheKeys(storeConfig.keyPrefix()), leaseConfig.duration(), clock, metrics);
    }

    public RecordLeaseService(
            CacheStore store, CacheKeys keys, Duration leaseDuration, Clock clock, SecurityMetrics metrics) {
        this.store = store;
        this.keys = keys;
        this.leaseDuration = leaseDuration;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public Uni<EditLease> acquire(LeaseTarget target, String principalId) {
        return recorded("acquire", update(target.recordId(), "acquire", MAX_ATTEMPTS, (leases, now) -> {
                    final var blocking = leases.blocking(target, principalId);
                    if (blocking.isPresent()) {
                        LOG.debugf("%s is blocked by the lease of %s on %s",
                                target, blocking.get().holder(), blocking.get().target());
                        throw LeaseException.alreadyLocked(blocking.get());
                    }
                    final var existing = leases.find(target);
                    if (existing.isPresent()) {
                        LOG.debugf("%s already holds lease on %s", principalId, target);
                        return Change.keep(existing.get());
                    }
                    final var lease = new EditLease(target, principalId, now, now.plus(leaseDuration));
                    return Change.write(leases.with(lease), lease);
                }))
                .invoke(lease -> LOG.infof("%s holds lease on %s until %s", principalId, target, lease.expiresAt()));
    }

    @Override
    public Uni<EditLease> renew(LeaseTarget target, String principalId) {
        return recorded("renew", update(target.recordId(), "renew", MAX_ATTEMPTS, (leases, now) -> {
            final var renewed = requireHeld(leases, target, principalId).withExpiresAt(now.plus(leaseDuration));
            LOG.debugf("%s renewing lease on %s until %s", principalId, target, renewed.expiresAt());
            return Change.write(leases.with(renewed), renewed);
        }));
    }

    @Override
    public Uni<Void> release(LeaseTarget target, String principalId) {
        return recorded("release", update(target.recordId(), "release", MAX_ATTEMPTS, (leases, now) -> {
                    final var existing = leases.find(target);
                    if (existing.isEmpty()) {
                        LOG.debugf("No live lease on %s to release", target);
                        return Change.keep(false);
                    }
                    if (!existing.get().isHeldBy(principalId)) {
                        throw LeaseException.notHolder(target, principalId);
                    }
                    return Change.write(leases.without(target), true);
                }))
                .invoke(released -> {
                    if (released) {
                        LOG.infof("%s released lease on %s", principalId, target);
                    }
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<LeaseStatus> status(LeaseTarget target) {
        return read(target.recordId()).map(stored -> stored.live()
                .covering(target)
                .<LeaseStatus>map(lease -> new LeaseStatus.Held(target, lease.holder(), lease.expiresAt()))
                .orElseGet(() -> new LeaseStatus.Free(target)));
    }

    /**
     * Passes when the caller holds the target's own lease or the lease on the
     * whole record.
     */
    @Override
    public Uni<EditLease> verifyHeld(LeaseTarget target, String principalId) {
        return read(target.recordId())
                .map(stored -> {
                    final var leases = stored.live();
                    final var whole = LeaseTarget.record(target.recordId());
                    return leases.find(target)
                            .filter(lease -> lease.isHeldBy(principalId))
                            .or(() -> leases.find(whole).filter(lease -> lease.isHeldBy(principalId)))
                            .orElseThrow(() -> leases.blocking(target, principalId).isPresent()
                                    ? LeaseException.notHolder(target, principalId)
                                    : LeaseException.expired(target));
                })
                .onFailure(SecurityStateException.class)
                .invoke(error -> metrics.recordLeaseOperation(
                        "verify", ((SecurityStateException) error).kind().name()));
    }

    private EditLease requireHeld(RecordLeases leases, LeaseTarget target, String principalId) {
        final var existing = leases.find(target).orElseThrow(() -> LeaseException.expired(target));
        if (!existing.isHeldBy(principalId)) {
            throw LeaseException.notHolder(target, principalId);
        }
        return existing;
    }

    private <T> Uni<T> recorded(String operation, Uni<T> outcome) {
        return outcome.invoke(result -> metrics.recordLeaseOperation(operation, "ok"))
                .onFailure(SecurityStateException.class)
                .invoke(error -> metrics.recordLeaseOperation(
                        operation, ((SecurityStateException) error).kind().name()));
    }

    private <T> Uni<T> update(String recordId, String operation, int attemptsLeft, Decision<T> decision) {
        return read(recordId).flatMap(stored -> {
            final var change = decision.decide(stored.live(), stored.readAt());
            if (!change.writes()) {
                return Uni.createFrom().item(change.result());
            }
            return write(recordId, stored, change.next()).flatMap(written -> {
                if (written) {
                    return Uni.createFrom().item(change.result());
                }
                if (attemptsLeft > 1) {
                    LOG.debugf("Leases on record %s changed concurrently, retrying %s", recordId, operation);
                    return update(recordId, operation, attemptsLeft - 1, decision);
                }
                return Uni.createFrom().<T>failure(new StoreUnavailableException(
                        operation, "Leases on record %s are changing hands".formatted(recordId)));
            });
        });
    }

    private Uni<Boolean> write(String recordId, StoredLeases observed, RecordLeases next) {
        final var key = keys.lease(recordId);
        if (observed.raw().isEmpty()) {
            if (next.isEmpty()) {
                return Uni.createFrom().item(true);
            }
            return store.setIfAbsent(key, next.toStoredValue(), ttl(next, observed.readAt()))
                    .onFailure(StoreUnavailableException.class)
                    .retry()
                    .atMost(1);
        }
        if (next.isEmpty()) {
            return store.compareAndDelete(key, observed.raw().get());
        }
        return store.compareAndSet(key, observed.raw().get(), next.toStoredValue(), ttl(next, observed.readAt()));
    }

    private static Duration ttl(RecordLeases leases, Instant now) {
        return Duration.between(now, leases.latestExpiry().orElseThrow());
    }

    private Uni<StoredLeases> read(String recordId) {
        return store.get(keys.lease(recordId)).map(raw -> {
            final var now = clock.instant();
            final var leases = raw.map(value -> RecordLeases.fromStoredValue(recordId, value))
                    .orElseGet(() -> RecordLeases.none(recordId));
            return new StoredLeases(raw, leases.liveAt(now), now);
        });
    }

    /**
     * The leases of a record together with the exact value they were read
     * from, for compare operations.
     */
    private record StoredLeases(Optional<String> raw, RecordLeases live, Instant readAt) {}

    @FunctionalInterface
    private interface Decision<T> {
        Change<T> decide(RecordLeases live, Instant now);
    }

    private record Change<T>(T result, RecordLeases next, boolean writes) {
        static <T> Change<T> keep(T result) {
            return new Change<>(result, null, false);
        }

        static <T> Change<T> write(RecordLeases next, T result) {
            return new Change<>(result, next, true);
        }
    }
}
