package haven.core.model.lease;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Every lease held on one CRM record, stored together under the record's key
 * so that whole-record and section leases are checked and changed in one
 * atomic write.
 *
 * <p>A whole-record lease overlaps every section of the record; two section
 * leases overlap only when they name the same section.
 *
 * @param recordId the record
 * @param leases   leases on the record or its sections, at most one per target
 */
public record RecordLeases(String recordId, List<EditLease> leases) {

    private static final String LINE_SEPARATOR = "\n";
    private static final String FIELD_SEPARATOR = "|";

    public RecordLeases {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("Record id cannot be null or blank");
        }
        leases = leases == null ? List.of() : List.copyOf(leases);
        for (EditLease lease : leases) {
            if (!lease.target().recordId().equals(recordId)) {
                throw new IllegalArgumentException("Lease on %s does not belong to record %s"
                        .formatted(lease.target(), recordId));
            }
        }
    }

    public static RecordLeases none(String recordId) {
        return new RecordLeases(recordId, List.of());
    }

    public boolean isEmpty() {
        return leases.isEmpty();
    }

    /**
     * Drop leases whose expiry has passed.
     */
    public RecordLeases liveAt(Instant now) {
        return new RecordLeases(
                recordId, leases.stream().filter(lease -> !lease.isExpiredAt(now)).toList());
    }

    /**
     * The lease on exactly this target, if any.
     */
    public Optional<EditLease> find(LeaseTarget target) {
        return leases.stream().filter(lease -> lease.target().equals(target)).findFirst();
    }

    /**
     * The first lease held by someone other than {@code principalId} that
     * overlaps the target.
     */
    public Optional<EditLease> blocking(LeaseTarget target, String principalId) {
        return leases.stream()
                .filter(lease -> !lease.isHeldBy(principalId))
                .filter(lease -> overlaps(lease.target(), target))
                .findFirst();
    }

    /**
     * The lease that would stop anyone but its holder from editing the
     * target: the target's own lease first, then the whole-record lease, then,
     * for a whole record, any section lease.
     */
    public Optional<EditLease> covering(LeaseTarget target) {
        return find(target)
                .or(() -> find(LeaseTarget.record(recordId)))
                .or(() -> leases.stream().filter(lease -> overlaps(lease.target(), target)).findFirst());
    }

    /**
     * Add a lease, replacing any lease on the same target.
     */
    public RecordLeases with(EditLease lease) {
        final var next = new ArrayList<EditLease>(leases.size() + 1);
        leases.stream().filter(existing -> !existing.target().equals(lease.target())).forEach(next::add);
        next.add(lease);
        return new RecordLeases(recordId, next);
    }

    public RecordLeases without(LeaseTarget target) {
        return new RecordLeases(
                recordId, leases.stream().filter(lease -> !lease.target().equals(target)).toList());
    }

    /**
     * Latest expiry among the leases, which bounds the TTL of the stored entry.
     */
    public Optional<Instant> latestExpiry() {
        return leases.stream().map(EditLease::expiresAt).max(Instant::compareTo);
    }

    /**
     * Serialize to one line per lease: {@code holder|acquiredAtMillis|expiresAtMillis|section},
     * with an empty section for the whole record.
     */
    public String toStoredValue() {
        final var lines = new ArrayList<String>(leases.size());
        for (EditLease lease : leases) {
            final var section = lease.target().section();
            lines.add(lease.toStoredValue() + FIELD_SEPARATOR + (section == null ? "" : section));
        }
        return String.join(LINE_SEPARATOR, lines);
    }

    /**
     * Parse a value written by {@link #toStoredValue()}.
     *
     * @throws IllegalArgumentException if the value is not in the stored format
     */
    public static RecordLeases fromStoredValue(String recordId, String value) {
        final var leases = new ArrayList<EditLease>();
        for (String line : value.split(LINE_SEPARATOR)) {
            if (line.isEmpty()) {
                continue;
            }
            final var cut = nthSeparator(line, 3);
            if (cut < 0) {
                throw new IllegalArgumentException("Invalid lease format");
            }
            final var target = new LeaseTarget(recordId, line.substring(cut + 1));
            leases.add(EditLease.fromStoredValue(target, line.substring(0, cut)));
        }
        return new RecordLeases(recordId, leases);
    }

    private static boolean overlaps(LeaseTarget held, LeaseTarget wanted) {
        return held.section() == null || wanted.section() == null || held.section().equals(wanted.section());
    }

    private static int nthSeparator(String line, int n) {
        var index = -1;
        for (int i = 0; i < n; i++) {
            index = line.indexOf(FIELD_SEPARATOR, index + 1);
            if (index < 0) {
                return -1;
            }
        }
        return index;
    }
}
