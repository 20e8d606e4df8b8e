package wattle.adapter.out.notification;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.UniEmitter;
import org.jboss.logging.Logger;

import wattle.core.model.backchannel.BackChannelAuthenticationStatus;
import wattle.core.port.out.BackChannelStatusNotifier;

/**
 * Status change notifier for long-polling token requests within one instance.
 *
 * <p>Each waiting token request registers an emitter under its {@code auth_req_id}.
 * A notification completes and drops every emitter of that id. An emitter deregisters
 * itself when its wait terminates for any reason (notification, timeout or cancellation
 * by a disconnecting client), so abandoned waits leave nothing behind.
 */
public class InMemoryBackChannelStatusNotifier implements BackChannelStatusNotifier {

    private static final Logger LOG = Logger.getLogger(InMemoryBackChannelStatusNotifier.class);

    private final ConcurrentMap<String, Set<UniEmitter<? super Boolean>>> waiters = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> waitForStatusChange(String authenticationRequestId, Duration timeout) {
        return Uni.createFrom()
                .<Boolean>emitter(emitter -> {
                    waiters.compute(authenticationRequestId, (id, registered) -> {
                        final Set<UniEmitter<? super Boolean>> set =
                                registered != null ? registered : ConcurrentHashMap.newKeySet();
                        set.add(emitter);
                        return set;
                    });
                    emitter.onTermination(() -> removeWaiter(authenticationRequestId, emitter));
                })
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.debugf("No status change for authentication request %s within %s", authenticationRequestId, timeout);
                    return false;
                });
    }

    @Override
    public Uni<Void> notifyStatusChange(String authenticationRequestId, BackChannelAuthenticationStatus status) {
        return Uni.createFrom().item(() -> {
            notifyLocalWaiters(authenticationRequestId, status);
            return null;
        });
    }

    /**
     * Completes every waiter registered on this instance for the request.
     *
     * @return the number of woken waiters
     */
    public int notifyLocalWaiters(String authenticationRequestId, BackChannelAuthenticationStatus status) {
        final var registered = waiters.remove(authenticationRequestId);
        if (registered == null) {
            return 0;
        }
        LOG.debugf(
                "Waking %d waiters of authentication request %s (status: %s)",
                registered.size(), authenticationRequestId, status);
        registered.forEach(emitter -> emitter.complete(true));
        return registered.size();
    }

    /**
     * Number of waiters registered for a request.
     */
    public int getWaiterCount(String authenticationRequestId) {
        final var registered = waiters.get(authenticationRequestId);
        return registered != null ? registered.size() : 0;
    }

    private void removeWaiter(String authenticationRequestId, UniEmitter<? super Boolean> emitter) {
        waiters.computeIfPresent(authenticationRequestId, (id, registered) -> {
            registered.remove(emitter);
            return registered.isEmpty() ? null : registered;
        });
    }
}
