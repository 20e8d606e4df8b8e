package wattle.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for grant state storage (codes, CIBA and device requests,
 * token registry, replay cache).
 *
 * <p>Configuration prefix: {@code wattle.oidc.storage}
 */
@ConfigMapping(prefix = "wattle.oidc.storage")
public interface EntityStorageConfig {

    /**
     * Storage provider name.
     *
     * <p>Available providers: redis, memory, or custom SPI name.
     *
     * @return provider name (default: memory)
     */
    @WithDefault("memory")
    String provider();

    /**
     * Redis-specific configuration.
     */
    RedisConfig redis();

    /**
     * Redis storage configuration.
     */
    interface RedisConfig {

        /**
         * Prefix prepended to every key.
         *
         * @return key prefix (default: wattle:)
         */
        @WithDefault("wattle:")
        String keyPrefix();

        /**
         * Timeout of a single Redis operation.
         *
         * @return operation timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration timeout();
    }
}
