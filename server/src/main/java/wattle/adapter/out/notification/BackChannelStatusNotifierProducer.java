package wattle.adapter.out.notification;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.RedisDataSource;
import org.jboss.logging.Logger;

import wattle.core.config.BackChannelAuthenticationConfig;
import wattle.core.port.out.BackChannelStatusNotifier;

/**
 * CDI producer selecting the status change notifier from
 * {@code wattle.oidc.backchannel-authentication.notifier.type}.
 */
@ApplicationScoped
public class BackChannelStatusNotifierProducer {

    private static final Logger LOG = Logger.getLogger(BackChannelStatusNotifierProducer.class);

    private final BackChannelAuthenticationConfig config;
    private final Instance<RedisDataSource> redisDataSource;

    @Inject
    public BackChannelStatusNotifierProducer(
            BackChannelAuthenticationConfig config, Instance<RedisDataSource> redisDataSource) {
        this.config = config;
        this.redisDataSource = redisDataSource;
    }

    @Produces
    @ApplicationScoped
    public BackChannelStatusNotifier backChannelStatusNotifier() {
        final var type = config.notifier().type();
        if ("redis".equals(type)) {
            LOG.info("Using Redis pub/sub for authentication status notifications");
            return new RedisBackChannelStatusNotifier(
                    redisDataSource.get(), config.notifier().channel(), new InMemoryBackChannelStatusNotifier());
        }
        if (!"memory".equals(type)) {
            LOG.warnf("Unknown authentication status notifier '%s', using in-memory notifier", type);
        }
        return new InMemoryBackChannelStatusNotifier();
    }

    void close(@Disposes BackChannelStatusNotifier notifier) {
        if (notifier instanceof RedisBackChannelStatusNotifier redisNotifier) {
            redisNotifier.close();
        }
    }
}
