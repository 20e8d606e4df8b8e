package wattle.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for authorization codes.
 *
 * <p>Configuration prefix: {@code wattle.oidc.authorization-code}
 */
@ConfigMapping(prefix = "wattle.oidc.authorization-code")
public interface AuthorizationCodeConfig {

    /**
     * How long an authorization code can be redeemed.
     *
     * @return code lifetime (default: 1 minute)
     */
    @WithDefault("PT1M")
    Duration lifetime();

    /**
     * Length in bytes of generated codes, before encoding.
     *
     * @return code length (default: 32)
     */
    @WithDefault("32")
    int length();
}
