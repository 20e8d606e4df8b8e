package wattle.core.service.backchannel;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import wattle.core.config.BackChannelAuthenticationConfig;
import wattle.core.model.backchannel.BackChannelAuthenticationRequest;
import wattle.core.model.storage.StorageOptions;
import wattle.core.port.out.EntityStorage;
import wattle.core.service.common.RandomValueGenerator;

/**
 * Persists backchannel authentication requests under their {@code auth_req_id}.
 *
 * <p>Entries expire at the request's own {@code expiresAt}.
 */
@ApplicationScoped
public class BackChannelAuthenticationStorage {

    private static final String KEY_PREFIX = "ciba:";
    private static final int MIN_REQUEST_ID_LENGTH = 16;

    private final EntityStorage storage;
    private final RandomValueGenerator randomValueGenerator;
    private final int requestIdLength;

    @Inject
    public BackChannelAuthenticationStorage(
            EntityStorage storage, RandomValueGenerator randomValueGenerator, BackChannelAuthenticationConfig config) {
        this.storage = storage;
        this.randomValueGenerator = randomValueGenerator;
        this.requestIdLength = Math.max(config.requestIdLength(), MIN_REQUEST_ID_LENGTH);
    }

    /**
     * Stores a new request under a generated id.
     *
     * @return the {@code auth_req_id}
     */
    public Uni<String> store(BackChannelAuthenticationRequest request) {
        final var requestId = randomValueGenerator.randomUrlSafe(requestIdLength);
        return update(requestId, request).replaceWith(requestId);
    }

    public Uni<Optional<BackChannelAuthenticationRequest>> tryGet(String requestId) {
        return storage.get(key(requestId), BackChannelAuthenticationRequest.class, false);
    }

    /**
     * Overwrites a request, keeping its original expiry.
     */
    public Uni<Void> update(String requestId, BackChannelAuthenticationRequest request) {
        return storage.set(key(requestId), request, StorageOptions.expiresAt(request.expiresAt()));
    }

    /**
     * Overwrites a request with an explicit remaining lifetime.
     */
    public Uni<Void> update(String requestId, BackChannelAuthenticationRequest request, Duration remaining) {
        return storage.set(key(requestId), request, StorageOptions.expiresIn(remaining));
    }

    /**
     * Deletes a request.
     *
     * @return true if this call removed it; false when it was already gone
     */
    public Uni<Boolean> tryRemove(String requestId) {
        return storage.remove(key(requestId));
    }

    private static String key(String requestId) {
        return KEY_PREFIX + requestId;
    }
}
