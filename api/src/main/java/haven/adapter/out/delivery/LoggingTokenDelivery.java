package haven.adapter.out.delivery;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import haven.core.model.auth.IssuedToken;
import haven.core.port.out.TokenDelivery;

/**
 * Default token delivery that only records the hand-off.
 *
 * <p>Replace with a mail-sending bean in deployments that deliver tokens.
 * The token itself is never logged.
 */
@ApplicationScoped
public class LoggingTokenDelivery implements TokenDelivery {

    private static final Logger LOG = Logger.getLogger(LoggingTokenDelivery.class);

    @Override
    public Uni<Void> deliver(String recipient, IssuedToken token) {
        return Uni.createFrom().item(() -> {
            LOG.infof(
                    "Handing off %s token for %s (expires %s)",
                    token.claims().kind().claimValue(), recipient, token.claims().expiresAt());
            return null;
        });
    }
}
