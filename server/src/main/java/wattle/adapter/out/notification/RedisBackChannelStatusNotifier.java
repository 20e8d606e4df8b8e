package wattle.adapter.out.notification;

import java.time.Duration;
import java.util.function.Consumer;

import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.pubsub.PubSubCommands;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import wattle.core.model.backchannel.BackChannelAuthenticationStatus;
import wattle.core.port.out.BackChannelStatusNotifier;

/**
 * Redis pub/sub status change notifier.
 *
 * <p>Status changes are published on a channel every instance subscribes to, so a
 * token request long-polling on one instance wakes when the user completes the
 * authentication through another. Waiting itself is delegated to an
 * {@link InMemoryBackChannelStatusNotifier} per instance.
 *
 * <p>Message format: {@code {status}:{authReqId}}
 */
public class RedisBackChannelStatusNotifier implements BackChannelStatusNotifier {

    private static final Logger LOG = Logger.getLogger(RedisBackChannelStatusNotifier.class);
    private static final String MESSAGE_SEPARATOR = ":";

    private final InMemoryBackChannelStatusNotifier localNotifier;
    private final PubSubCommands<String> pubsub;
    private final String channel;
    private final PubSubCommands.RedisSubscriber subscriber;

    public RedisBackChannelStatusNotifier(
            RedisDataSource redisDataSource, String channel, InMemoryBackChannelStatusNotifier localNotifier) {
        this.localNotifier = localNotifier;
        this.pubsub = redisDataSource.pubsub(String.class);
        this.channel = channel;
        this.subscriber = pubsub.subscribe(channel, new MessageHandler());
        LOG.infof("Subscribed to authentication status changes on channel: %s", channel);
    }

    @Override
    public Uni<Boolean> waitForStatusChange(String authenticationRequestId, Duration timeout) {
        return localNotifier.waitForStatusChange(authenticationRequestId, timeout);
    }

    @Override
    public Uni<Void> notifyStatusChange(String authenticationRequestId, BackChannelAuthenticationStatus status) {
        final var message = status.name() + MESSAGE_SEPARATOR + authenticationRequestId;
        return Uni.createFrom()
                .item(() -> {
                    pubsub.publish(channel, message);
                    LOG.debugf("Published status change of authentication request %s", authenticationRequestId);
                    return null;
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .replaceWithVoid();
    }

    /**
     * Unsubscribes from the status channel.
     */
    public void close() {
        try {
            subscriber.unsubscribe();
            LOG.info("Unsubscribed from authentication status changes");
        } catch (RuntimeException e) {
            LOG.warnf(e, "Error unsubscribing from authentication status changes");
        }
    }

    private class MessageHandler implements Consumer<String> {

        @Override
        public void accept(String message) {
            final var separator = message.indexOf(MESSAGE_SEPARATOR);
            if (separator <= 0 || separator == message.length() - 1) {
                LOG.warnf("Invalid authentication status message: %s", message);
                return;
            }
            try {
                final var status = BackChannelAuthenticationStatus.valueOf(message.substring(0, separator));
                localNotifier.notifyLocalWaiters(message.substring(separator + 1), status);
            } catch (IllegalArgumentException e) {
                LOG.warnf("Unknown authentication status in message: %s", message);
            }
        }
    }
}
