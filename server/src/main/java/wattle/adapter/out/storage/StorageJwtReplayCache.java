package wattle.adapter.out.storage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.config.JwtBearerConfig;
import wattle.core.model.storage.StorageOptions;
import wattle.core.port.out.EntityStorage;
import wattle.core.port.out.JwtReplayCache;

/**
 * Replay cache for JWT assertions backed by grant state storage.
 *
 * <p>A used {@code jti} is kept until the assertion's expiry plus clock skew, so it cannot
 * validate again while it could still be accepted. Assertions without {@code exp} are kept
 * for {@link #DEFAULT_RETENTION}; entries never live shorter than {@link #MINIMUM_RETENTION}.
 */
@ApplicationScoped
public class StorageJwtReplayCache implements JwtReplayCache {

    private static final Logger LOG = Logger.getLogger(StorageJwtReplayCache.class);
    private static final String KEY_PREFIX = "jwt_replay:";

    static final Duration DEFAULT_RETENTION = Duration.ofHours(1);
    static final Duration MINIMUM_RETENTION = Duration.ofSeconds(10);

    private final EntityStorage storage;
    private final JwtBearerConfig config;
    private final Clock clock;

    @Inject
    public StorageJwtReplayCache(EntityStorage storage, JwtBearerConfig config, Clock clock) {
        this.storage = storage;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<Boolean> isReplayed(String jwtId) {
        return storage.get(KEY_PREFIX + jwtId, Boolean.class, false).map(entry -> entry.isPresent());
    }

    @Override
    public Uni<Void> markAsUsed(String jwtId, Instant expiresAt) {
        final var retention = retention(expiresAt);
        LOG.debugf("Marking JWT %s as used for %s", jwtId, retention);
        return storage.set(KEY_PREFIX + jwtId, Boolean.TRUE, StorageOptions.expiresIn(retention));
    }

    Duration retention(Instant expiresAt) {
        if (expiresAt == null) {
            return DEFAULT_RETENTION;
        }
        final var retention = Duration.between(clock.instant(), expiresAt).plus(config.clockSkew());
        return retention.compareTo(MINIMUM_RETENTION) < 0 ? MINIMUM_RETENTION : retention;
    }
}
