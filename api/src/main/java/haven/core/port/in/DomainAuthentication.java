package haven.core.port.in;

import io.smallrye.mutiny.Uni;

import haven.core.model.auth.TokenPair;

/**
 * Inbound port for the password grant.
 */
public interface DomainAuthentication {

    /**
     * Authenticate and mint an access/refresh pair bound to a domain.
     *
     * @param username        login name
     * @param password        password
     * @param requestedDomain domain to log into; when null the principal's
     *                        only domain is selected
     * @return the token pair
     */
    Uni<TokenPair> authenticate(String username, String password, String requestedDomain);
}
