package wattle.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for client-initiated backchannel authentication (CIBA).
 *
 * <p>Configuration prefix: {@code wattle.oidc.backchannel-authentication}
 */
@ConfigMapping(prefix = "wattle.oidc.backchannel-authentication")
public interface BackChannelAuthenticationConfig {

    /**
     * Minimum interval between two token requests for the same authentication request.
     *
     * @return polling interval (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration pollingInterval();

    /**
     * Lifetime of an authentication request when the client does not request one.
     *
     * @return default expiry (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration defaultExpiry();

    /**
     * Upper bound on the lifetime a client may request.
     *
     * @return maximum expiry (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration maximumExpiry();

    /**
     * Length in bytes of generated {@code auth_req_id} values, before encoding.
     *
     * @return request id length (default: 64)
     */
    @WithDefault("64")
    int requestIdLength();

    /**
     * Hold pending token requests open until the user responds or the timeout elapses.
     *
     * @return true if long polling is enabled (default: false)
     */
    @WithDefault("false")
    boolean useLongPolling();

    /**
     * How long a long-polling token request waits for a status change.
     *
     * @return long polling timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration longPollingTimeout();

    /**
     * Status change notification settings.
     */
    NotifierConfig notifier();

    /**
     * Status change notifier options.
     */
    interface NotifierConfig {

        /**
         * Notifier implementation: {@code memory} (single instance) or {@code redis} (pub/sub).
         *
         * @return notifier name (default: memory)
         */
        @WithDefault("memory")
        String type();

        /**
         * Redis pub/sub channel carrying status changes.
         *
         * @return channel name (default: wattle:ciba-status)
         */
        @WithDefault("wattle:ciba-status")
        String channel();
    }
}
