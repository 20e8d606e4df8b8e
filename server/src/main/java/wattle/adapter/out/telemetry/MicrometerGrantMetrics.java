package wattle.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import wattle.core.port.out.GrantMetrics;

/**
 * Micrometer backed grant metrics.
 *
 * <p>Records:
 * <ul>
 *   <li>{@code wattle.grant.authorizations} - token requests by grant type and outcome</li>
 *   <li>{@code wattle.grant.jwt_bearer.replays} - rejected assertion replays by issuer</li>
 *   <li>{@code wattle.grant.ciba.long_poll} - long-polling waits, tagged by whether they were woken</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerGrantMetrics implements GrantMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerGrantMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAuthorization(String grantType, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("wattle.grant.authorizations")
                .description("Token requests by grant type and outcome")
                .tag("grant_type", nullSafe(grantType))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordReplayDetected(String issuer) {
        if (!enabled) {
            return;
        }

        Counter.builder("wattle.grant.jwt_bearer.replays")
                .description("Rejected JWT bearer assertion replays")
                .tag("issuer", nullSafe(issuer))
                .register(registry)
                .increment();
    }

    @Override
    public void recordLongPoll(boolean notified, long durationMs) {
        if (!enabled) {
            return;
        }

        Timer.builder("wattle.grant.ciba.long_poll")
                .description("Time CIBA polls spent waiting for a status change")
                .tag("notified", String.valueOf(notified))
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
