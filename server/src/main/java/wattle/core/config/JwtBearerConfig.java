package wattle.core.config;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the JWT bearer authorization grant (RFC 7523).
 *
 * <p>Configuration prefix: {@code wattle.oidc.jwt-bearer}
 *
 * <p>Example:
 * <pre>{@code
 * wattle.oidc.jwt-bearer.trusted-issuers.partner.issuer=https://idp.partner.example
 * wattle.oidc.jwt-bearer.trusted-issuers.partner.jwks-uri=https://idp.partner.example/jwks
 * wattle.oidc.jwt-bearer.trusted-issuers.partner.allowed-scopes=orders,profile
 * }</pre>
 */
@ConfigMapping(prefix = "wattle.oidc.jwt-bearer")
public interface JwtBearerConfig {

    /**
     * Tolerance applied to {@code exp}, {@code nbf} and {@code iat}.
     */
    @WithDefault("PT5M")
    Duration clockSkew();

    /**
     * Require a {@code jti} claim and reject assertions whose {@code jti} was seen before.
     */
    @WithDefault("true")
    boolean requireJti();

    /**
     * Maximum length of the serialized assertion.
     */
    @WithDefault("8192")
    int maxJwtSize();

    /**
     * Only accept the token endpoint URI as audience. When false the application
     * base URI is accepted too.
     */
    @WithDefault("true")
    boolean strictAudienceValidation();

    /**
     * Reject assertions whose {@code iat} is older than this.
     */
    Optional<Duration> maxJwtAge();

    /**
     * Accepted {@code typ} header values. Any value is accepted when absent.
     */
    Optional<List<String>> allowedTokenTypes();

    /**
     * Signing algorithms accepted when neither the client nor the issuer restrict them.
     */
    @WithDefault("RS256,RS384,RS512,ES256,ES384,ES512,PS256,PS384,PS512")
    List<String> defaultAllowedAlgorithms();

    /**
     * How long fetched issuer key sets are cached.
     */
    @WithDefault("PT1H")
    Duration jwksCacheDuration();

    /**
     * Timeout for fetching an issuer key set.
     */
    @WithDefault("PT5S")
    Duration jwksFetchTimeout();

    /**
     * Minimum time between two fetches of a key set triggered by an unknown {@code kid}.
     */
    @WithDefault("PT1M")
    Duration jwksMinRefreshInterval();

    /**
     * Maximum number of cached issuer key sets.
     */
    @WithDefault("100")
    int jwksMaxCacheEntries();

    /**
     * Issuers whose assertions are accepted, keyed by an arbitrary name.
     */
    Map<String, TrustedIssuerConfig> trustedIssuers();

    /**
     * A trusted issuer.
     */
    interface TrustedIssuerConfig {

        /** Expected {@code iss} value. */
        String issuer();

        /** Location of the issuer's key set. */
        URI jwksUri();

        /** Accepted signing algorithms; the defaults apply when absent. */
        Optional<List<String>> allowedAlgorithms();

        /** Scope values the issuer may request; unrestricted when absent. */
        Optional<List<String>> allowedScopes();
    }
}
