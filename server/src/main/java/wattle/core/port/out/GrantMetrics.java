package wattle.core.port.out;

/**
 * Port for recording grant authorization metrics.
 */
public interface GrantMetrics {

    /**
     * Records the outcome of a token request.
     *
     * @param grantType the requested grant type
     * @param outcome   {@code success} or the OAuth error code
     */
    void recordAuthorization(String grantType, String outcome);

    /**
     * Records a rejected JWT assertion replay.
     *
     * @param issuer the assertion issuer
     */
    void recordReplayDetected(String issuer);

    /**
     * Records a long-polling wait and whether it was woken by a notification.
     */
    void recordLongPoll(boolean notified, long durationMs);
}
