package wattle.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the device authorization grant (RFC 8628).
 *
 * <p>Configuration prefix: {@code wattle.oidc.device-authorization}
 */
@ConfigMapping(prefix = "wattle.oidc.device-authorization")
public interface DeviceAuthorizationConfig {

    /**
     * Minimum interval between two token requests from the same device.
     *
     * @return polling interval (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration pollingInterval();

    /**
     * Lifetime of device and user codes.
     *
     * @return code lifetime (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration codeLifetime();
}
