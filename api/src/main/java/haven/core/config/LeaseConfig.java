package haven.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for CRM record edit leases.
 *
 * <p>Configuration prefix: {@code haven.crm.lease}
 */
@ConfigMapping(prefix = "haven.crm.lease")
public interface LeaseConfig {

    /**
     * How long a lease lives after acquisition or renewal.
     *
     * @return lease duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration duration();
}
