package wattle.adapter.out.storage;

import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import wattle.core.model.jwt.TokenStatus;
import wattle.core.model.storage.StorageOptions;
import wattle.core.port.out.EntityStorage;
import wattle.core.port.out.TokenRegistry;

/**
 * Token status registry backed by grant state storage. Entries expire with their token.
 */
@ApplicationScoped
public class StorageTokenRegistry implements TokenRegistry {

    private static final String KEY_PREFIX = "token_status:";

    private final EntityStorage storage;

    @Inject
    public StorageTokenRegistry(EntityStorage storage) {
        this.storage = storage;
    }

    @Override
    public Uni<Optional<TokenStatus>> getStatus(String jwtId) {
        return storage.get(KEY_PREFIX + jwtId, TokenStatus.class, false);
    }

    @Override
    public Uni<Void> setStatus(String jwtId, TokenStatus status, Instant expiresAt) {
        return storage.set(KEY_PREFIX + jwtId, status, StorageOptions.expiresAt(expiresAt));
    }
}
