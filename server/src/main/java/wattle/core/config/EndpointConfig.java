package wattle.core.config;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Public addresses of the server, used to validate assertion audiences.
 *
 * <p>Configuration prefix: {@code wattle.oidc.endpoints}
 */
@ConfigMapping(prefix = "wattle.oidc.endpoints")
public interface EndpointConfig {

    /**
     * Public base URI of the application.
     */
    @WithDefault("http://localhost:8080/")
    URI applicationUri();

    /**
     * Path of the token endpoint relative to {@link #applicationUri()}.
     */
    @WithDefault("/connect/token")
    String tokenPath();

    /**
     * IP addresses or CIDR ranges of reverse proxies whose {@code X-Forwarded-For} header is
     * honoured. When empty, the caller address is always the direct peer.
     */
    Optional<List<String>> trustedProxies();
}
