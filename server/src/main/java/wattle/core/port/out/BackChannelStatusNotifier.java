package wattle.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import wattle.core.model.backchannel.BackChannelAuthenticationStatus;

/**
 * Port waking long-polling token requests when a backchannel authentication request changes.
 */
public interface BackChannelStatusNotifier {

    /**
     * Waits for a status change of an authentication request.
     *
     * <p>Cancelling the returned {@link Uni} stops waiting and releases the waiter.
     *
     * @param authenticationRequestId the {@code auth_req_id}
     * @param timeout                 maximum wait
     * @return true if a change was signalled, false on timeout
     */
    Uni<Boolean> waitForStatusChange(String authenticationRequestId, Duration timeout);

    /**
     * Signals every waiter of an authentication request.
     *
     * @param authenticationRequestId the {@code auth_req_id}
     * @param status                  the new status
     */
    Uni<Void> notifyStatusChange(String authenticationRequestId, BackChannelAuthenticationStatus status);
}
