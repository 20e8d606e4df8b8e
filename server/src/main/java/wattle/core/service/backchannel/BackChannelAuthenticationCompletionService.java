package wattle.core.service.backchannel;

import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.model.backchannel.BackChannelAuthenticationRequest;
import wattle.core.model.backchannel.BackChannelAuthenticationStatus;
import wattle.core.model.grant.AuthSession;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.port.out.BackChannelStatusNotifier;

/**
 * Records the user's answer to a backchannel authentication request and wakes
 * long-polling token requests waiting on it.
 */
@ApplicationScoped
public class BackChannelAuthenticationCompletionService {

    private static final Logger LOG = Logger.getLogger(BackChannelAuthenticationCompletionService.class);

    private final BackChannelAuthenticationStorage storage;
    private final BackChannelStatusNotifier notifier;

    @Inject
    public BackChannelAuthenticationCompletionService(
            BackChannelAuthenticationStorage storage, BackChannelStatusNotifier notifier) {
        this.storage = storage;
        this.notifier = notifier;
    }

    /**
     * Marks a pending request authenticated by the given session.
     *
     * @return true if a pending request was found and updated
     */
    public Uni<Boolean> complete(String requestId, AuthSession session) {
        return transition(requestId, BackChannelAuthenticationStatus.AUTHENTICATED, request -> {
            final var grant = new AuthorizedGrant(session, request.authorizedGrant().context());
            return request.withAuthorizedGrant(grant).withStatus(BackChannelAuthenticationStatus.AUTHENTICATED);
        });
    }

    /**
     * Marks a pending request denied by the user.
     *
     * @return true if a pending request was found and updated
     */
    public Uni<Boolean> deny(String requestId) {
        return transition(
                requestId,
                BackChannelAuthenticationStatus.DENIED,
                request -> request.withStatus(BackChannelAuthenticationStatus.DENIED));
    }

    private Uni<Boolean> transition(
            String requestId,
            BackChannelAuthenticationStatus status,
            UnaryOperator<BackChannelAuthenticationRequest> change) {
        return storage.tryGet(requestId).flatMap(found -> {
            if (found.isEmpty()) {
                LOG.debugf("Authentication request %s not found", requestId);
                return Uni.createFrom().item(false);
            }
            if (found.get().status() != BackChannelAuthenticationStatus.PENDING) {
                LOG.debugf("Authentication request %s is already %s", requestId, found.get().status());
                return Uni.createFrom().item(false);
            }

            return storage.update(requestId, change.apply(found.get()))
                    .flatMap(v -> notifier.notifyStatusChange(requestId, status))
                    .invoke(() -> LOG.infof("Authentication request %s is now %s", requestId, status))
                    .replaceWith(true);
        });
    }
}
