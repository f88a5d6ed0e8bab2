package haven.adapter.in.dto;

import haven.core.model.lease.LeaseStatus;

/**
 * DTO for the lock state of a record or section.
 *
 * @param recordId  the record
 * @param section   the section, null for the whole record
 * @param locked    whether a live lease exists
 * @param holder    principal id of the holder, null when free
 * @param expiresAt lease expiry (ISO-8601), null when free
 */
public record LeaseStatusResponse(String recordId, String section, boolean locked, String holder, String expiresAt) {

    public static LeaseStatusResponse fromModel(LeaseStatus status) {
        if (status instanceof LeaseStatus.Held held) {
            return new LeaseStatusResponse(
                    held.target().recordId(),
                    held.target().section(),
                    true,
                    held.holder(),
                    held.expiresAt().toString());
        }
        final var free = (LeaseStatus.Free) status;
        return new LeaseStatusResponse(free.target().recordId(), free.target().section(), false, null, null);
    }
}
