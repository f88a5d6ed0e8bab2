package haven.core.service.lease;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import haven.core.exception.FailureKind;
import haven.core.exception.LeaseException;
import haven.core.exception.SecurityStateException;
import haven.core.exception.StoreUnavailableException;
import haven.core.model.lease.EditLease;
import haven.core.model.lease.LeaseStatus;
import haven.core.model.lease.LeaseTarget;
import haven.core.model.lease.RecordLeases;
import haven.core.port.out.CacheStore;
import haven.core.port.out.SecurityMetrics;
import haven.core.util.CacheKeys;
import haven.support.MutableClock;
import haven.support.SecurityStateFixture;

@DisplayName("RecordLeaseService")
class RecordLeaseServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final LeaseTarget RECORD = LeaseTarget.record("animal-42");

    private SecurityStateFixture fixture;
    private RecordLeaseService leases;

    @BeforeEach
    void setUp() {
        fixture = new SecurityStateFixture();
        leases = fixture.leases;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static FailureKind failureOf(Uni<?> operation) {
        return assertThrows(SecurityStateException.class, () -> operation.await().atMost(TIMEOUT)).kind();
    }

    private EditLease acquire(LeaseTarget target, String principalId) {
        return leases.acquire(target, principalId).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("acquire()")
    class AcquireTests {

        @Test
        @DisplayName("should grant a 15 minute lease on a free record")
        void grantsFreeRecord() {
            var lease = acquire(RECORD, "u-alice");

            assertEquals("u-alice", lease.holder());
            assertEquals(fixture.clock.instant(), lease.acquiredAt());
            assertEquals(fixture.clock.instant().plus(Duration.ofMinutes(15)), lease.expiresAt());
            verify(fixture.metrics).recordLeaseOperation("acquire", "ok");
        }

        @Test
        @DisplayName("should refuse a second principal and name the holder")
        void refusesSecondPrincipal() {
            var held = acquire(RECORD, "u-alice");

            var error = assertThrows(
                    LeaseException.class, () -> leases.acquire(RECORD, "u-bob").await().atMost(TIMEOUT));

            assertEquals(FailureKind.ALREADY_LOCKED, error.kind());
            assertEquals(held, error.blockingLease().orElseThrow());
            verify(fixture.metrics).recordLeaseOperation("acquire", "ALREADY_LOCKED");
        }

        @Test
        @DisplayName("should hand the holder back its existing lease")
        void reentrant() {
            var first = acquire(RECORD, "u-alice");
            fixture.clock.advance(Duration.ofMinutes(5));

            var second = acquire(RECORD, "u-alice");

            assertEquals(first, second);
        }

        @Test
        @DisplayName("should free the record for others once the lease lapses")
        void lapses() {
            acquire(RECORD, "u-alice");

            fixture.clock.advance(Duration.ofMinutes(14));
            assertEquals(FailureKind.ALREADY_LOCKED, failureOf(leases.acquire(RECORD, "u-bob")));

            fixture.clock.advance(Duration.ofMinutes(2));
            assertEquals("u-bob", acquire(RECORD, "u-bob").holder());
        }

        @Test
        @DisplayName("should take over a stored lease whose own expiry has passed")
        void takesOverStaleValue() {
            var stale = new EditLease(
                    RECORD,
                    "u-alice",
                    fixture.clock.instant().minus(Duration.ofMinutes(20)),
                    fixture.clock.instant().minus(Duration.ofMinutes(5)));
            fixture.store.set(
                            fixture.keys.lease("animal-42"),
                            new RecordLeases("animal-42", List.of(stale)).toStoredValue(),
                            Duration.ofHours(1))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("u-bob", acquire(RECORD, "u-bob").holder());
        }

        @Test
        @DisplayName("should let exactly one of many concurrent callers win")
        void concurrentAcquire() throws Exception {
            final var callers = 8;
            final var executor = Executors.newFixedThreadPool(callers);
            final var start = new CountDownLatch(1);
            try {
                final var results = new ArrayList<Future<EditLease>>();
                for (int i = 0; i < callers; i++) {
                    final var principal = "u-" + i;
                    Callable<EditLease> task = () -> {
                        start.await();
                        return leases.acquire(RECORD, principal).await().atMost(TIMEOUT);
                    };
                    results.add(executor.submit(task));
                }
                start.countDown();

                var winners = 0;
                for (var result : results) {
                    try {
                        result.get(10, TimeUnit.SECONDS);
                        winners++;
                    } catch (ExecutionException e) {
                        var lease = assertInstanceOf(LeaseException.class, e.getCause());
                        assertEquals(FailureKind.ALREADY_LOCKED, lease.kind());
                    }
                }
                assertEquals(1, winners);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Sections")
    class SectionTests {

        private final LeaseTarget medical = LeaseTarget.section("animal-42", "medical");
        private final LeaseTarget adoption = LeaseTarget.section("animal-42", "adoption");

        @Test
        @DisplayName("should lease different sections of one record independently")
        void independentSections() {
            acquire(medical, "u-alice");
            acquire(adoption, "u-bob");

            var expiresAt = fixture.clock.instant().plus(Duration.ofMinutes(15));
            assertEquals(
                    new LeaseStatus.Held(medical, "u-alice", expiresAt),
                    leases.status(medical).await().atMost(TIMEOUT));
            assertEquals("u-bob", ((LeaseStatus.Held) leases.status(adoption).await().atMost(TIMEOUT)).holder());
        }

        @Test
        @DisplayName("a whole-record lease should lock every section for others")
        void recordLocksSections() {
            var whole = acquire(RECORD, "u-alice");

            var error = assertThrows(
                    LeaseException.class, () -> leases.acquire(medical, "u-bob").await().atMost(TIMEOUT));

            assertEquals(FailureKind.ALREADY_LOCKED, error.kind());
            assertEquals(whole, error.blockingLease().orElseThrow());
            assertEquals(FailureKind.NOT_HOLDER, failureOf(leases.verifyHeld(medical, "u-bob")));
            assertEquals("u-alice", ((LeaseStatus.Held) leases.status(medical).await().atMost(TIMEOUT)).holder());
        }

        @Test
        @DisplayName("a section lease should keep others from leasing the whole record")
        void sectionLocksRecord() {
            var section = acquire(medical, "u-alice");

            var error = assertThrows(
                    LeaseException.class, () -> leases.acquire(RECORD, "u-bob").await().atMost(TIMEOUT));

            assertEquals(section, error.blockingLease().orElseThrow());
            assertEquals("u-alice", ((LeaseStatus.Held) leases.status(RECORD).await().atMost(TIMEOUT)).holder());
        }

        @Test
        @DisplayName("the holder of the whole record may edit and lease its sections")
        void holderMayNarrow() {
            var whole = acquire(RECORD, "u-alice");

            assertEquals(whole, leases.verifyHeld(medical, "u-alice").await().atMost(TIMEOUT));
            assertEquals(medical, acquire(medical, "u-alice").target());

            leases.release(RECORD, "u-alice").await().atMost(TIMEOUT);
            assertEquals(FailureKind.ALREADY_LOCKED, failureOf(leases.acquire(RECORD, "u-bob")));
            assertEquals("u-bob", acquire(adoption, "u-bob").holder());
        }

        @Test
        @DisplayName("should free the record once the blocking section lease lapses")
        void sectionLapses() {
            acquire(medical, "u-alice");
            fixture.clock.advance(Duration.ofMinutes(16));

            assertEquals("u-bob", acquire(RECORD, "u-bob").holder());
        }

        @Test
        @DisplayName("racing whole-record and section acquisitions should never both win")
        void recordAndSectionRace() throws Exception {
            final var executor = Executors.newFixedThreadPool(2);
            try {
                for (int round = 0; round < 20; round++) {
                    final var record = "race-" + round;
                    final var start = new CountDownLatch(1);
                    Callable<EditLease> whole = () -> {
                        start.await();
                        return leases.acquire(LeaseTarget.record(record), "u-alice").await().atMost(TIMEOUT);
                    };
                    Callable<EditLease> section = () -> {
                        start.await();
                        return leases.acquire(LeaseTarget.section(record, "notes"), "u-bob")
                                .await()
                                .atMost(TIMEOUT);
                    };
                    var first = executor.submit(whole);
                    var second = executor.submit(section);
                    start.countDown();

                    var winners = 0;
                    for (var result : List.of(first, second)) {
                        try {
                            result.get(10, TimeUnit.SECONDS);
                            winners++;
                        } catch (ExecutionException e) {
                            var lease = assertInstanceOf(LeaseException.class, e.getCause());
                            assertEquals(FailureKind.ALREADY_LOCKED, lease.kind());
                        }
                    }
                    assertEquals(1, winners);
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("renew()")
    class RenewTests {

        @Test
        @DisplayName("should push the expiry out by a full lease duration")
        void extendsExpiry() {
            var original = acquire(RECORD, "u-alice");
            fixture.clock.advance(Duration.ofMinutes(10));

            var renewed = leases.renew(RECORD, "u-alice").await().atMost(TIMEOUT);

            assertEquals(original.acquiredAt(), renewed.acquiredAt());
            assertEquals(fixture.clock.instant().plus(Duration.ofMinutes(15)), renewed.expiresAt());

            fixture.clock.advance(Duration.ofMinutes(10));
            assertEquals(FailureKind.ALREADY_LOCKED, failureOf(leases.acquire(RECORD, "u-bob")));
        }

        @Test
        @DisplayName("should refuse a principal that does not hold the lease")
        void notHolder() {
            acquire(RECORD, "u-alice");

            assertEquals(FailureKind.NOT_HOLDER, failureOf(leases.renew(RECORD, "u-bob")));
        }

        @Test
        @DisplayName("should refuse to revive a lapsed lease")
        void lapsed() {
            acquire(RECORD, "u-alice");
            fixture.clock.advance(Duration.ofMinutes(16));

            assertEquals(FailureKind.LEASE_EXPIRED, failureOf(leases.renew(RECORD, "u-alice")));
        }

        @Test
        @DisplayName("should refuse a record that was never leased")
        void neverLeased() {
            assertEquals(FailureKind.LEASE_EXPIRED, failureOf(leases.renew(RECORD, "u-alice")));
        }
    }

    @Nested
    @DisplayName("release()")
    class ReleaseTests {

        @Test
        @DisplayName("should free the record for the next editor")
        void releases() {
            acquire(RECORD, "u-alice");

            leases.release(RECORD, "u-alice").await().atMost(TIMEOUT);

            assertInstanceOf(LeaseStatus.Free.class, leases.status(RECORD).await().atMost(TIMEOUT));
            assertEquals("u-bob", acquire(RECORD, "u-bob").holder());
        }

        @Test
        @DisplayName("should refuse a principal that does not hold the lease")
        void notHolder() {
            acquire(RECORD, "u-alice");

            assertEquals(FailureKind.NOT_HOLDER, failureOf(leases.release(RECORD, "u-bob")));
            assertInstanceOf(LeaseStatus.Held.class, leases.status(RECORD).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should succeed when there is nothing to release")
        void nothingToRelease() {
            leases.release(RECORD, "u-alice").await().atMost(TIMEOUT);
        }

        @Test
        @DisplayName("should succeed after the lease has lapsed")
        void afterLapse() {
            acquire(RECORD, "u-alice");
            fixture.clock.advance(Duration.ofMinutes(16));

            leases.release(RECORD, "u-bob").await().atMost(TIMEOUT);
        }
    }

    @Nested
    @DisplayName("verifyHeld() and status()")
    class VerifyTests {

        @Test
        @DisplayName("should confirm the holder")
        void confirmsHolder() {
            var lease = acquire(RECORD, "u-alice");

            assertEquals(lease, leases.verifyHeld(RECORD, "u-alice").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should reject everyone else")
        void rejectsOthers() {
            acquire(RECORD, "u-alice");

            assertEquals(FailureKind.NOT_HOLDER, failureOf(leases.verifyHeld(RECORD, "u-bob")));
        }

        @Test
        @DisplayName("should reject a lapsed lease")
        void rejectsLapsed() {
            acquire(RECORD, "u-alice");
            fixture.clock.advance(Duration.ofMinutes(15));

            assertEquals(FailureKind.LEASE_EXPIRED, failureOf(leases.verifyHeld(RECORD, "u-alice")));
        }

        @Test
        @DisplayName("status() should report a free record")
        void freeStatus() {
            assertEquals(new LeaseStatus.Free(RECORD), leases.status(RECORD).await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailureTests {

        private final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
        private final CacheStore store = mock(CacheStore.class);
        private final SecurityMetrics metrics = mock(SecurityMetrics.class);
        private final RecordLeaseService service = new RecordLeaseService(
                store, new CacheKeys("test:"), Duration.ofMinutes(15), clock, metrics);

        @Test
        @DisplayName("should retry a set-if-absent that failed once")
        void retriesOnce() {
            var attempts = new AtomicInteger();
            when(store.get("test:lease:animal-42")).thenReturn(Uni.createFrom().item(Optional.<String>empty()));
            when(store.setIfAbsent(eq("test:lease:animal-42"), anyString(), any(Duration.class)))
                    .thenReturn(Uni.createFrom().item(() -> {
                        if (attempts.incrementAndGet() == 1) {
                            throw new StoreUnavailableException("setIfAbsent", "timed out");
                        }
                        return true;
                    }));

            var lease = service.acquire(RECORD, "u-alice").await().atMost(TIMEOUT);

            assertEquals("u-alice", lease.holder());
            assertEquals(2, attempts.get());
        }

        @Test
        @DisplayName("should report STORE_UNAVAILABLE when the store stays down")
        void staysDown() {
            when(store.get("test:lease:animal-42")).thenReturn(Uni.createFrom().item(Optional.<String>empty()));
            when(store.setIfAbsent(eq("test:lease:animal-42"), anyString(), any(Duration.class)))
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("setIfAbsent", "down")));

            var error = assertThrows(
                    StoreUnavailableException.class, () -> service.acquire(RECORD, "u-alice").await().atMost(TIMEOUT));

            assertTrue(error.kind().retryable());
            verify(metrics).recordLeaseOperation("acquire", "STORE_UNAVAILABLE");
        }

        @Test
        @DisplayName("should give up with STORE_UNAVAILABLE when every compare-and-set loses")
        void keepsLosingRaces() {
            var other = new EditLease(
                    LeaseTarget.section("animal-42", "medical"),
                    "u-bob",
                    clock.instant(),
                    clock.instant().plus(Duration.ofMinutes(15)));
            when(store.get("test:lease:animal-42")).thenReturn(Uni.createFrom()
                    .item(Optional.of(new RecordLeases("animal-42", List.of(other)).toStoredValue())));
            when(store.compareAndSet(eq("test:lease:animal-42"), anyString(), anyString(), any(Duration.class)))
                    .thenReturn(Uni.createFrom().item(false));

            var target = LeaseTarget.section("animal-42", "adoption");
            assertEquals(FailureKind.STORE_UNAVAILABLE, failureOf(service.acquire(target, "u-alice")));
            verify(store, times(3))
                    .compareAndSet(eq("test:lease:animal-42"), anyString(), anyString(), any(Duration.class));
        }

        @Test
        @DisplayName("status() should not report a record as free when the store is down")
        void statusFailsClosed() {
            when(store.get("test:lease:animal-42"))
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("get", "down")));

            assertEquals(FailureKind.STORE_UNAVAILABLE, failureOf(service.status(RECORD)));
        }
    }
}
