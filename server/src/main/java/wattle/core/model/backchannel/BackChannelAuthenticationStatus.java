package wattle.core.model.backchannel;

/**
 * Progress of a backchannel authentication request.
 */
public enum BackChannelAuthenticationStatus {
    PENDING,
    AUTHENTICATED,
    DENIED
}
