package wattle.core.model.device;

import java.time.Instant;
import java.util.List;

import wattle.core.model.grant.AuthorizedGrant;

/**
 * Stored state of a device authorization request, keyed by its device code.
 *
 * @param clientId        client that started the device flow
 * @param userCode        code the user enters on the verification page
 * @param scope           requested scope
 * @param status          current status
 * @param authorizedGrant grant recorded when the user approves, null until then
 * @param expiresAt       when the device code expires
 * @param nextPollAt      earliest time the device may poll again, null if never polled
 */
public record DeviceAuthorizationRequest(
        String clientId,
        String userCode,
        List<String> scope,
        DeviceAuthorizationStatus status,
        AuthorizedGrant authorizedGrant,
        Instant expiresAt,
        Instant nextPollAt) {

    public DeviceAuthorizationRequest {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client ID cannot be null or blank");
        }
        if (userCode == null || userCode.isBlank()) {
            throw new IllegalArgumentException("User code cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry cannot be null");
        }
        scope = scope != null ? List.copyOf(scope) : List.of();
    }

    public static DeviceAuthorizationRequest pending(
            String clientId, String userCode, List<String> scope, Instant expiresAt) {
        return new DeviceAuthorizationRequest(
                clientId, userCode, scope, DeviceAuthorizationStatus.PENDING, null, expiresAt, null);
    }

    public DeviceAuthorizationRequest withNextPollAt(Instant newNextPollAt) {
        return new DeviceAuthorizationRequest(
                clientId, userCode, scope, status, authorizedGrant, expiresAt, newNextPollAt);
    }

    public DeviceAuthorizationRequest authorized(AuthorizedGrant grant) {
        return new DeviceAuthorizationRequest(
                clientId, userCode, scope, DeviceAuthorizationStatus.AUTHORIZED, grant, expiresAt, nextPollAt);
    }

    public DeviceAuthorizationRequest denied() {
        return new DeviceAuthorizationRequest(
                clientId, userCode, scope, DeviceAuthorizationStatus.DENIED, authorizedGrant, expiresAt, nextPollAt);
    }
}
