package wattle.core.model.jwt;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header values and claims of a validated JWT.
 *
 * @param algorithm {@code alg} header
 * @param type      {@code typ} header, may be null
 * @param keyId     {@code kid} header, may be null
 * @param subject   {@code sub} claim, may be null
 * @param issuer    {@code iss} claim, may be null
 * @param audiences {@code aud} claim values
 * @param jwtId     {@code jti} claim, may be null
 * @param issuedAt  {@code iat} claim, may be null
 * @param expiresAt {@code exp} claim, may be null
 * @param claims    all claims of the payload
 */
public record JsonWebToken(
        String algorithm,
        String type,
        String keyId,
        String subject,
        String issuer,
        List<String> audiences,
        String jwtId,
        Instant issuedAt,
        Instant expiresAt,
        Map<String, Object> claims) {

    public JsonWebToken {
        audiences = audiences != null ? List.copyOf(audiences) : List.of();
        claims = claims != null ? Collections.unmodifiableMap(new LinkedHashMap<>(claims)) : Map.of();
    }

    /**
     * Returns a claim as a string, or null when absent.
     */
    public String stringClaim(String name) {
        final var value = claims.get(name);
        return value != null ? value.toString() : null;
    }
}
