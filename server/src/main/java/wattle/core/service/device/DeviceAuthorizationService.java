package wattle.core.service.device;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.config.DeviceAuthorizationConfig;
import wattle.core.model.device.DeviceAuthorizationRequest;
import wattle.core.model.device.DeviceAuthorizationStatus;
import wattle.core.model.grant.AuthSession;
import wattle.core.model.grant.AuthorizationContext;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.service.common.RandomValueGenerator;

/**
 * Starts device authorization requests and records the user's decision entered on
 * the verification page.
 */
@ApplicationScoped
public class DeviceAuthorizationService {

    private static final Logger LOG = Logger.getLogger(DeviceAuthorizationService.class);
    private static final int DEVICE_CODE_BYTES = 32;
    private static final String USER_CODE_ALPHABET = "BCDFGHJKLMNPQRSTVWXZ";
    private static final int USER_CODE_LENGTH = 8;

    private final DeviceAuthorizationStorage storage;
    private final RandomValueGenerator randomValueGenerator;
    private final DeviceAuthorizationConfig config;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    @Inject
    public DeviceAuthorizationService(
            DeviceAuthorizationStorage storage,
            RandomValueGenerator randomValueGenerator,
            DeviceAuthorizationConfig config,
            Clock clock) {
        this.storage = storage;
        this.randomValueGenerator = randomValueGenerator;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Creates a pending request for a client.
     *
     * @return the device code and user code
     */
    public Uni<DeviceCodes> start(String clientId, List<String> scope) {
        final var deviceCode = randomValueGenerator.randomUrlSafe(DEVICE_CODE_BYTES);
        final var userCode = generateUserCode();
        final var expiresAt = clock.instant().plus(config.codeLifetime());
        return storage.store(deviceCode, DeviceAuthorizationRequest.pending(clientId, userCode, scope, expiresAt))
                .replaceWith(new DeviceCodes(deviceCode, userCode));
    }

    /**
     * Approves the pending request identified by a user code on behalf of a session.
     *
     * @return true if a pending request was found and approved
     */
    public Uni<Boolean> approve(String userCode, AuthSession session) {
        return transition(userCode, request -> {
            final var context = AuthorizationContext.of(request.clientId(), request.scope());
            return request.authorized(new AuthorizedGrant(session, context));
        });
    }

    /**
     * Denies the pending request identified by a user code.
     *
     * @return true if a pending request was found and denied
     */
    public Uni<Boolean> deny(String userCode) {
        return transition(userCode, DeviceAuthorizationRequest::denied);
    }

    private Uni<Boolean> transition(String userCode, UnaryOperator<DeviceAuthorizationRequest> change) {
        return storage.tryGetDeviceCode(userCode).flatMap(deviceCode -> {
            if (deviceCode.isEmpty()) {
                LOG.debug("Unknown or expired user code");
                return Uni.createFrom().item(false);
            }
            return storage.tryGetByDeviceCode(deviceCode.get()).flatMap(found -> {
                if (found.isEmpty() || found.get().status() != DeviceAuthorizationStatus.PENDING) {
                    return Uni.createFrom().item(false);
                }
                final var updated = change.apply(found.get());
                return storage.update(deviceCode.get(), updated)
                        .invoke(() -> LOG.infof(
                                "Device authorization for client %s is now %s",
                                updated.clientId(),
                                updated.status()))
                        .replaceWith(true);
            });
        });
    }

    private String generateUserCode() {
        final var code = new StringBuilder(USER_CODE_LENGTH);
        for (var i = 0; i < USER_CODE_LENGTH; i++) {
            code.append(USER_CODE_ALPHABET.charAt(secureRandom.nextInt(USER_CODE_ALPHABET.length())));
        }
        return code.toString();
    }

    /**
     * Codes returned from the device authorization endpoint.
     */
    public record DeviceCodes(String deviceCode, String userCode) {}
}
