package wattle.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry.
 *
 * <p>Example configuration:
 * <pre>{@code
 * wattle.telemetry.enabled=true
 * wattle.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "wattle.telemetry")
public interface TelemetryConfig {

    /**
     * Master toggle. When disabled, metrics are off regardless of their own setting.
     */
    @WithDefault("true")
    boolean enabled();

    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable Micrometer metrics for grant authorization.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
