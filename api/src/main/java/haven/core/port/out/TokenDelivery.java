package haven.core.port.out;

import io.smallrye.mutiny.Uni;

import haven.core.model.auth.IssuedToken;

/**
 * Port for handing invitation and reset tokens to whoever delivers them to
 * the recipient (typically a mail sender).
 */
public interface TokenDelivery {

    /**
     * Deliver a token.
     *
     * @param recipient email address or username of the recipient
     * @param token     the token to deliver
     * @return Uni completing when the token has been handed off
     */
    Uni<Void> deliver(String recipient, IssuedToken token);
}
