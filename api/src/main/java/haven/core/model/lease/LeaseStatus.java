package haven.core.model.lease;

import java.time.Instant;

/**
 * Read-only view of a lease target: either free or held by someone.
 */
public sealed interface LeaseStatus {

    /**
     * No live lease exists on the target.
     */
    record Free(LeaseTarget target) implements LeaseStatus {}

    /**
     * A live lease exists.
     *
     * @param target    the leased target
     * @param holder    principal id of the holder
     * @param expiresAt when the lease lapses unless renewed
     */
    record Held(LeaseTarget target, String holder, Instant expiresAt) implements LeaseStatus {}
}
