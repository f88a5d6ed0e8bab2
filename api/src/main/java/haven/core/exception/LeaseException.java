package haven.core.exception;

import java.util.Optional;

import haven.core.model.lease.EditLease;
import haven.core.model.lease.LeaseTarget;

/**
 * Raised when an edit lease cannot be acquired, renewed, released or verified.
 *
 * <p>{@link FailureKind#ALREADY_LOCKED} failures carry the blocking lease so
 * callers can report who holds the record.
 */
public class LeaseException extends SecurityStateException {

    private final LeaseTarget target;
    private final EditLease blockingLease;

    private LeaseException(FailureKind kind, LeaseTarget target, EditLease blockingLease, String message) {
        super(kind, message);
        this.target = target;
        this.blockingLease = blockingLease;
    }

    public static LeaseException alreadyLocked(EditLease blockingLease) {
        return new LeaseException(
                FailureKind.ALREADY_LOCKED,
                blockingLease.target(),
                blockingLease,
                "%s is being edited by %s".formatted(blockingLease.target(), blockingLease.holder()));
    }

    public static LeaseException notHolder(LeaseTarget target, String principalId) {
        return new LeaseException(
                FailureKind.NOT_HOLDER, target, null, "%s does not hold the lease on %s".formatted(principalId, target));
    }

    public static LeaseException expired(LeaseTarget target) {
        return new LeaseException(FailureKind.LEASE_EXPIRED, target, null, "Lease on %s has expired".formatted(target));
    }

    public LeaseTarget target() {
        return target;
    }

    /**
     * The lease that blocked acquisition, present only for ALREADY_LOCKED.
     */
    public Optional<EditLease> blockingLease() {
        return Optional.ofNullable(blockingLease);
    }
}
