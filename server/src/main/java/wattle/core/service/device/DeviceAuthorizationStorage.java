package wattle.core.service.device;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import wattle.core.model.device.DeviceAuthorizationRequest;
import wattle.core.model.storage.StorageOptions;
import wattle.core.port.out.EntityStorage;

/**
 * Persists device authorization requests under their device code, with a secondary
 * entry mapping the user code to the device code.
 */
@ApplicationScoped
public class DeviceAuthorizationStorage {

    private static final String DEVICE_CODE_PREFIX = "device_code:";
    private static final String USER_CODE_PREFIX = "user_code:";

    private final EntityStorage storage;

    @Inject
    public DeviceAuthorizationStorage(EntityStorage storage) {
        this.storage = storage;
    }

    /**
     * Stores a new request and its user code index until the request expires.
     */
    public Uni<Void> store(String deviceCode, DeviceAuthorizationRequest request) {
        final var options = StorageOptions.expiresAt(request.expiresAt());
        return storage.set(DEVICE_CODE_PREFIX + deviceCode, request, options)
                .flatMap(v -> storage.set(USER_CODE_PREFIX + request.userCode(), deviceCode, options));
    }

    public Uni<Optional<DeviceAuthorizationRequest>> tryGetByDeviceCode(String deviceCode) {
        return storage.get(DEVICE_CODE_PREFIX + deviceCode, DeviceAuthorizationRequest.class, false);
    }

    /**
     * Resolves a user code to its device code.
     */
    public Uni<Optional<String>> tryGetDeviceCode(String userCode) {
        return storage.get(USER_CODE_PREFIX + userCode, String.class, false);
    }

    /**
     * Overwrites a request, keeping its original expiry.
     */
    public Uni<Void> update(String deviceCode, DeviceAuthorizationRequest request) {
        return storage.set(DEVICE_CODE_PREFIX + deviceCode, request, StorageOptions.expiresAt(request.expiresAt()));
    }

    /**
     * Deletes a request and its user code index.
     */
    public Uni<Void> remove(String deviceCode, String userCode) {
        return tryRemove(deviceCode, userCode).replaceWithVoid();
    }

    /**
     * Atomically claims a request by deleting it.
     *
     * <p>When several callers race, exactly one gets {@code true}; the others find the
     * device code already gone. The user code index is removed by the winner.
     *
     * @return true if this call removed the device code entry
     */
    public Uni<Boolean> tryRemove(String deviceCode, String userCode) {
        return storage.remove(DEVICE_CODE_PREFIX + deviceCode).flatMap(removed -> {
            if (!removed) {
                return Uni.createFrom().item(false);
            }
            return storage.remove(USER_CODE_PREFIX + userCode).replaceWith(true);
        });
    }
}
