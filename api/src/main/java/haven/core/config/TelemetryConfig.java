package haven.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for telemetry.
 *
 * <p>Configuration prefix: {@code haven.telemetry}
 */
@ConfigMapping(prefix = "haven.telemetry")
public interface TelemetryConfig {

    MetricsConfig metrics();

    interface MetricsConfig {

        /**
         * Enable security metrics.
         *
         * @return true if metrics are recorded (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
