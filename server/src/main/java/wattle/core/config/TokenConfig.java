package wattle.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for tokens issued by the server itself.
 *
 * <p>Configuration prefix: {@code wattle.oidc.tokens}
 */
@ConfigMapping(prefix = "wattle.oidc.tokens")
public interface TokenConfig {

    /**
     * Issuer identifier placed in and expected from server issued tokens.
     */
    @WithDefault("http://localhost:8080")
    String issuer();

    /**
     * PEM or base64 PKCS8 RSA private key for signing. An ephemeral key is
     * generated when absent.
     */
    Optional<String> signingKey();

    /**
     * Key identifier ({@code kid}) of the signing key.
     */
    @WithDefault("wattle-key-1")
    String keyId();

    /**
     * Absolute lifetime of refresh tokens.
     */
    @WithDefault("P30D")
    Duration refreshTokenLifetime();

    /**
     * Tolerance applied when validating server issued tokens.
     */
    @WithDefault("PT30S")
    Duration clockSkew();
}
