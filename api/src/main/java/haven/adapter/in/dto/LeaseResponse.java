package haven.adapter.in.dto;

import haven.core.model.lease.EditLease;

/**
 * DTO for a held edit lease.
 */
public record LeaseResponse(String recordId, String section, String holder, String acquiredAt, String expiresAt) {

    public static LeaseResponse fromModel(EditLease lease) {
        return new LeaseResponse(
                lease.target().recordId(),
                lease.target().section(),
                lease.holder(),
                lease.acquiredAt().toString(),
                lease.expiresAt().toString());
    }
}
