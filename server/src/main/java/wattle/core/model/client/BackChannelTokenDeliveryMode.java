package wattle.core.model.client;

import java.util.Locale;

/**
 * How a client receives tokens for backchannel (CIBA) authentication requests.
 */
public enum BackChannelTokenDeliveryMode {
    /** Client polls the token endpoint until the user has authenticated. */
    POLL,
    /** Client is notified, then fetches tokens from the token endpoint. */
    PING,
    /** Tokens are pushed to the client; the token endpoint is never polled. */
    PUSH;

    /**
     * Parses a registered mode value ({@code poll}, {@code ping} or {@code push}).
     *
     * @return the mode, or null when the value is null or blank
     */
    public static BackChannelTokenDeliveryMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
