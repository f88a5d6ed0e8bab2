package haven.core.port.in;

import io.smallrye.mutiny.Uni;

import haven.core.model.lease.EditLease;
import haven.core.model.lease.LeaseStatus;
import haven.core.model.lease.LeaseTarget;

/**
 * Inbound port for exclusive edit leases on CRM records.
 *
 * <p>Leases never block: a contended acquire fails immediately with
 * {@link haven.core.exception.LeaseException} of kind ALREADY_LOCKED.
 */
public interface LeaseManagement {

    /**
     * Acquire the lease. Re-acquiring a lease the caller already holds returns
     * it unchanged.
     */
    Uni<EditLease> acquire(LeaseTarget target, String principalId);

    /**
     * Push the expiry of a held lease to now plus the lease duration.
     */
    Uni<EditLease> renew(LeaseTarget target, String principalId);

    /**
     * Release a held lease. Releasing an absent lease succeeds.
     */
    Uni<Void> release(LeaseTarget target, String principalId);

    Uni<LeaseStatus> status(LeaseTarget target);

    /**
     * Confirm the caller holds a live lease before a mutation.
     */
    Uni<EditLease> verifyHeld(LeaseTarget target, String principalId);
}
