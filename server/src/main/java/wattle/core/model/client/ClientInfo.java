package wattle.core.model.client;

import java.util.Set;

/**
 * Registered client as seen by the grant handlers.
 *
 * @param clientId                     client identifier
 * @param allowedGrantTypes            grant types the client may use at the token endpoint
 * @param backChannelTokenDeliveryMode CIBA delivery mode, null when not registered
 * @param offlineAccessAllowed         whether refresh tokens may be issued to the client
 * @param jwtBearerAllowedAlgorithms   signing algorithms the client accepts in JWT bearer
 *                                     assertions, empty to use the issuer or server defaults
 */
public record ClientInfo(
        String clientId,
        Set<String> allowedGrantTypes,
        BackChannelTokenDeliveryMode backChannelTokenDeliveryMode,
        boolean offlineAccessAllowed,
        Set<String> jwtBearerAllowedAlgorithms) {

    public ClientInfo {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client ID cannot be null or blank");
        }
        allowedGrantTypes = allowedGrantTypes != null ? Set.copyOf(allowedGrantTypes) : Set.of();
        jwtBearerAllowedAlgorithms =
                jwtBearerAllowedAlgorithms != null ? Set.copyOf(jwtBearerAllowedAlgorithms) : Set.of();
    }

    public static ClientInfo of(String clientId, Set<String> allowedGrantTypes) {
        return new ClientInfo(clientId, allowedGrantTypes, null, false, Set.of());
    }

    public ClientInfo withBackChannelTokenDeliveryMode(BackChannelTokenDeliveryMode mode) {
        return new ClientInfo(clientId, allowedGrantTypes, mode, offlineAccessAllowed, jwtBearerAllowedAlgorithms);
    }

    public boolean isGrantTypeAllowed(String grantType) {
        return grantType != null && allowedGrantTypes.stream().anyMatch(grantType::equalsIgnoreCase);
    }
}
