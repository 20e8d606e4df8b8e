package wattle.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import wattle.core.config.EntityStorageConfig;
import wattle.core.port.out.EntityStorage;
import wattle.spi.EntityStorageProvider;

/**
 * Redis-based grant storage provider.
 *
 * <p>The recommended provider for production: every instance sees the same codes,
 * CIBA requests and device requests.
 */
@ApplicationScoped
public class RedisEntityStorageProvider implements EntityStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisEntityStorageProvider.class);
    private static final int PRIORITY = 100;

    private enum AvailabilityState {
        CHECKING,
        AVAILABLE,
        UNAVAILABLE
    }

    private final ReactiveRedisDataSource redisDataSource;
    private final EntityStorageConfig config;
    private final Clock clock;

    private volatile RedisEntityStorage storage;
    private final AtomicReference<AvailabilityState> availabilityState =
            new AtomicReference<>(AvailabilityState.CHECKING);

    @Inject
    public RedisEntityStorageProvider(
            ReactiveRedisDataSource redisDataSource, EntityStorageConfig config, Clock clock) {
        this.redisDataSource = redisDataSource;
        this.config = config;
        this.clock = clock;
    }

    @PostConstruct
    void checkAvailability() {
        if (!name().equals(config.provider())) {
            availabilityState.set(AvailabilityState.UNAVAILABLE);
            return;
        }

        redisDataSource
                .key(String.class)
                .exists(config.redis().keyPrefix() + "connection-check")
                .ifNoItem()
                .after(Duration.ofSeconds(5))
                .fail()
                .subscribe()
                .with(
                        result -> {
                            availabilityState.set(AvailabilityState.AVAILABLE);
                            LOG.info("Redis grant storage is available");
                        },
                        error -> {
                            availabilityState.set(AvailabilityState.UNAVAILABLE);
                            LOG.warnf("Redis grant storage is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return availabilityState.get() == AvailabilityState.AVAILABLE;
    }

    @Override
    public synchronized EntityStorage createStorage() {
        if (storage == null) {
            final var timeoutHelper = new RedisTimeoutHelper(config.redis().timeout(), "grant-storage");
            storage = new RedisEntityStorage(redisDataSource, config.redis().keyPrefix(), timeoutHelper, clock);
            LOG.infof("Created Redis grant storage with prefix: %s", config.redis().keyPrefix());
        }
        return storage;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var state = availabilityState.get();
        if (state == AvailabilityState.AVAILABLE) {
            return Optional.of(HealthCheckResponse.named("grant-storage-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", config.redis().keyPrefix())
                    .build());
        }
        final var error = state == AvailabilityState.CHECKING ? "Availability check in progress" : "Redis not available";
        return Optional.of(HealthCheckResponse.named("grant-storage-redis")
                .down()
                .withData("type", "redis")
                .withData("error", error)
                .build());
    }
}
