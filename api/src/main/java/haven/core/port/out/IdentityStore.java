package haven.core.port.out;

import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import haven.core.model.auth.Principal;

/**
 * Port for the user-management collaborator that owns principals, their
 * credentials and their token epochs.
 */
public interface IdentityStore {

    /**
     * Check a username/password pair.
     *
     * @return Uni with the principal, or empty if the credentials do not match
     */
    Uni<Optional<Principal>> verifyCredentials(String username, String password);

    Uni<Optional<Principal>> findById(String principalId);

    Uni<Optional<Principal>> findByUsername(String username);

    /**
     * Domains the principal may authenticate against.
     */
    Set<String> authorizedDomains(Principal principal);

    /**
     * Check whether a domain exists at all.
     */
    boolean isKnownDomain(String domain);

    /**
     * Current token epoch of the principal. Absent epochs read as 0.
     */
    Uni<Long> currentEpoch(String principalId);

    /**
     * Atomically advance the principal's epoch, invalidating every token
     * issued before.
     *
     * @return Uni with the new epoch
     */
    Uni<Long> bumpEpoch(String principalId);

    /**
     * Replace the principal's password.
     */
    Uni<Void> updatePassword(String principalId, String newPassword);
}
