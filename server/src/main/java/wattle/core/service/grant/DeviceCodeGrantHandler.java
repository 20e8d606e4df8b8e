package wattle.core.service.grant;

import java.time.Clock;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.config.DeviceAuthorizationConfig;
import wattle.core.model.client.ClientInfo;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.GrantTypes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.device.DeviceAuthorizationRequest;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenRequest;
import wattle.core.port.in.AuthorizationGrantHandler;
import wattle.core.service.common.ParameterValidator;
import wattle.core.service.device.DeviceAuthorizationStorage;

/**
 * Token requests for the device authorization grant (RFC 8628).
 *
 * <p>An authorized request is handed out exactly once: the handler claims it with an
 * atomic removal and only the caller whose removal succeeds receives the grant.
 * Devices polling before {@code nextPollAt} get {@code slow_down} and their next
 * permitted poll moves one more interval away.
 */
@ApplicationScoped
public class DeviceCodeGrantHandler implements AuthorizationGrantHandler {

    private static final Logger LOG = Logger.getLogger(DeviceCodeGrantHandler.class);

    private final DeviceAuthorizationStorage storage;
    private final DeviceAuthorizationConfig config;
    private final Clock clock;

    @Inject
    public DeviceCodeGrantHandler(DeviceAuthorizationStorage storage, DeviceAuthorizationConfig config, Clock clock) {
        this.storage = storage;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Set<String> grantTypesSupported() {
        return Set.of(GrantTypes.DEVICE_CODE);
    }

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> authorize(TokenRequest request, ClientInfo clientInfo) {
        final var deviceCode = ParameterValidator.required(request.deviceCode(), "device_code");

        return storage.tryGetByDeviceCode(deviceCode).flatMap(found -> {
            if (found.isEmpty()) {
                LOG.debug("Device code not found or expired");
                return GrantResults.errorUni(ErrorCodes.EXPIRED_TOKEN, "The device code has expired");
            }

            final var deviceRequest = found.get();
            if (!deviceRequest.clientId().equals(clientInfo.clientId())) {
                LOG.warnv("Client {0} presented a device code issued to another client", clientInfo.clientId());
                return GrantResults.errorUni(ErrorCodes.INVALID_GRANT, "The device code was issued to another client");
            }

            return switch (deviceRequest.status()) {
                case AUTHORIZED -> claim(deviceCode, deviceRequest);
                case PENDING -> pending(deviceCode, deviceRequest);
                case DENIED -> storage.remove(deviceCode, deviceRequest.userCode())
                        .replaceWith(GrantResults.error(
                                ErrorCodes.ACCESS_DENIED, "The user denied the authorization request"));
                default -> throw new IllegalStateException(
                        "Unexpected device authorization status: " + deviceRequest.status());
            };
        });
    }

    private Uni<Result<AuthorizedGrant, OidcError>> claim(String deviceCode, DeviceAuthorizationRequest deviceRequest) {
        if (deviceRequest.authorizedGrant() == null) {
            throw new IllegalStateException("Authorized device request has no grant");
        }
        return storage.tryRemove(deviceCode, deviceRequest.userCode()).map(claimed -> {
            if (!claimed) {
                LOG.debugf("Device code for client %s was claimed concurrently", deviceRequest.clientId());
                return GrantResults.error(ErrorCodes.EXPIRED_TOKEN, "The device code has expired or was already used");
            }
            return GrantResults.granted(deviceRequest.authorizedGrant());
        });
    }

    private Uni<Result<AuthorizedGrant, OidcError>> pending(String deviceCode, DeviceAuthorizationRequest deviceRequest) {
        final var now = clock.instant();
        final var nextPollAt = deviceRequest.nextPollAt();

        if (nextPollAt != null && now.isBefore(nextPollAt)) {
            final var backedOff = deviceRequest.withNextPollAt(nextPollAt.plus(config.pollingInterval()));
            return storage.update(deviceCode, backedOff)
                    .replaceWith(GrantResults.error(ErrorCodes.SLOW_DOWN, "The device polls too frequently"));
        }

        final var updated = deviceRequest.withNextPollAt(now.plus(config.pollingInterval()));
        return storage.update(deviceCode, updated)
                .replaceWith(GrantResults.error(
                        ErrorCodes.AUTHORIZATION_PENDING, "The user has not yet completed the authorization"));
    }
}
