package wattle.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.quarkus.redis.datasource.value.SetArgs;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.model.storage.StorageOptions;
import wattle.core.port.out.EntityStorage;

/**
 * Redis implementation of grant state storage.
 *
 * <p>Values are stored as JSON envelopes carrying the serialized value and, for sliding
 * entries, the idle period. Expiration uses Redis TTLs: absolute entries get a fixed
 * {@code PXAT}, sliding entries get their TTL renewed on every read.
 *
 * <p>Retrieve-and-delete reads use {@code GETDEL}; {@link #remove} relies on {@code DEL}
 * returning the number of deleted keys, which makes concurrent claims race-free.
 */
public class RedisEntityStorage implements EntityStorage {

    private static final Logger LOG = Logger.getLogger(RedisEntityStorage.class);

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final RedisTimeoutHelper timeoutHelper;
    private final Clock clock;

    public RedisEntityStorage(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper, Clock clock) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
        this.timeoutHelper = timeoutHelper;
        this.clock = clock;
    }

    @Override
    public <T> Uni<Void> set(String key, T value, StorageOptions options) {
        final var redisKey = keyPrefix + key;
        final var slidingMillis =
                options.slidingExpiration() != null ? options.slidingExpiration().toMillis() : null;
        final var json = serialize(new Envelope(slidingMillis, OBJECT_MAPPER.valueToTree(value)));

        final var args = new SetArgs();
        final var expiry = options.resolveExpiry(clock.instant());
        if (expiry != null) {
            if (!expiry.isAfter(clock.instant())) {
                LOG.debugf("Entry %s already expired, removing instead of storing", key);
                return timeoutHelper.withTimeout(keyCommands.del(redisKey), "set").replaceWithVoid();
            }
            args.pxAt(expiry);
        } else if (options.slidingExpiration() != null) {
            args.px(options.slidingExpiration());
        }

        return timeoutHelper.withTimeout(valueCommands.set(redisKey, json, args), "set");
    }

    @Override
    public <T> Uni<Optional<T>> get(String key, Class<T> type, boolean removeOnRetrieval) {
        final var redisKey = keyPrefix + key;
        final var read = removeOnRetrieval ? valueCommands.getdel(redisKey) : valueCommands.get(redisKey);

        final var operation = read.flatMap(json -> {
            if (json == null) {
                return Uni.createFrom().item(Optional.<T>empty());
            }
            final var envelope = deserialize(json);
            final var value = Optional.of(convert(envelope.value(), type));
            if (removeOnRetrieval || envelope.slidingMillis() == null) {
                return Uni.createFrom().item(value);
            }
            return keyCommands
                    .pexpire(redisKey, Duration.ofMillis(envelope.slidingMillis()))
                    .replaceWith(value);
        });
        return timeoutHelper.withTimeout(operation, removeOnRetrieval ? "getdel" : "get");
    }

    @Override
    public Uni<Boolean> remove(String key) {
        return timeoutHelper.withTimeout(keyCommands.del(keyPrefix + key).map(deleted -> deleted > 0), "remove");
    }

    private static String serialize(Envelope envelope) {
        try {
            return OBJECT_MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize storage entry", e);
        }
    }

    private static Envelope deserialize(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize storage entry", e);
        }
    }

    private static <T> T convert(JsonNode node, Class<T> type) {
        try {
            return OBJECT_MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    record Envelope(Long slidingMillis, JsonNode value) {}
}
