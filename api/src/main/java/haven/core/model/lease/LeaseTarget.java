package haven.core.model.lease;

/**
 * What an edit lease protects: a CRM record, optionally narrowed to one named
 * section of it. Leases on different sections of the same record are
 * independent; a lease on the whole record excludes every section lease.
 *
 * @param recordId record identifier
 * @param section  section name, null for the whole record
 */
public record LeaseTarget(String recordId, String section) {
    public LeaseTarget {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("Record id cannot be null or blank");
        }
        if (section != null && section.isBlank()) {
            section = null;
        }
        if (section != null && (section.contains("\n") || section.contains("\r"))) {
            throw new IllegalArgumentException("Section cannot contain line breaks");
        }
    }

    public static LeaseTarget record(String recordId) {
        return new LeaseTarget(recordId, null);
    }

    public static LeaseTarget section(String recordId, String section) {
        return new LeaseTarget(recordId, section);
    }

    @Override
    public String toString() {
        return section == null ? "record " + recordId : "section '%s' of record %s".formatted(section, recordId);
    }
}
