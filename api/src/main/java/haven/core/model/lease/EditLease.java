package haven.core.model.lease;

import java.time.Instant;

/**
 * An exclusive, time-bounded claim on a {@link LeaseTarget}.
 *
 * @param target     the leased record or section
 * @param holder     principal id of the editor
 * @param acquiredAt when the lease was first acquired
 * @param expiresAt  when the lease lapses unless renewed
 */
public record EditLease(LeaseTarget target, String holder, Instant acquiredAt, Instant expiresAt) {

    private static final String SEPARATOR = "|";

    public EditLease {
        if (target == null) {
            throw new IllegalArgumentException("Target cannot be null");
        }
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("Holder cannot be null or blank");
        }
        if (holder.contains(SEPARATOR) || holder.contains("\n")) {
            throw new IllegalArgumentException("Holder cannot contain '|' or line breaks");
        }
        if (acquiredAt == null || expiresAt == null) {
            throw new IllegalArgumentException("AcquiredAt and expiresAt are required");
        }
    }

    public boolean isHeldBy(String principalId) {
        return holder.equals(principalId);
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public EditLease withExpiresAt(Instant newExpiresAt) {
        return new EditLease(target, holder, acquiredAt, newExpiresAt);
    }

    /**
     * Serialize to the stored value: {@code holder|acquiredAtMillis|expiresAtMillis}.
     */
    public String toStoredValue() {
        return holder + SEPARATOR + acquiredAt.toEpochMilli() + SEPARATOR + expiresAt.toEpochMilli();
    }

    /**
     * Parse a stored value written by {@link #toStoredValue()}.
     *
     * @throws IllegalArgumentException if the value is not in the stored format
     */
    public static EditLease fromStoredValue(LeaseTarget target, String value) {
        var parts = value.split("\\|", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid lease format");
        }
        try {
            return new EditLease(
                    target,
                    parts[0],
                    Instant.ofEpochMilli(Long.parseLong(parts[1])),
                    Instant.ofEpochMilli(Long.parseLong(parts[2])));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid lease timestamps", e);
        }
    }
}
