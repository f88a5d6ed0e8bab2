package haven.core.model.auth;

import java.util.Set;

/**
 * An authenticated identity as supplied by the identity store.
 *
 * @param id          stable identifier, used as token subject
 * @param username    login name
 * @param domains     domains the principal may authenticate against
 * @param permissions permissions granted through the principal's role
 */
public record Principal(String id, String username, Set<String> domains, Set<String> permissions) {
    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Principal id cannot be null or blank");
        }
        domains = domains == null ? Set.of() : Set.copyOf(domains);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }
}
