package wattle.core.model.jwt;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKey;

/**
 * What a JWT validator checks and how it resolves issuers, audiences and keys.
 *
 * @param options            checks to perform
 * @param issuerValidator    accepts or rejects the {@code iss} claim
 * @param audienceValidator  accepts or rejects the {@code aud} claim values
 * @param signingKeyResolver resolves candidate verification keys from the unverified issuer and key id
 * @param clockSkew          tolerance applied to time based claims
 */
public record JwtValidationParameters(
        Set<JwtValidationOption> options,
        Function<String, Uni<Boolean>> issuerValidator,
        Function<List<String>, Uni<Boolean>> audienceValidator,
        Function<JsonWebToken, Uni<List<JsonWebKey>>> signingKeyResolver,
        Duration clockSkew) {

    public JwtValidationParameters {
        options = options != null && !options.isEmpty()
                ? EnumSet.copyOf(options)
                : EnumSet.noneOf(JwtValidationOption.class);
        if (signingKeyResolver == null) {
            throw new IllegalArgumentException("Signing key resolver cannot be null");
        }
        clockSkew = clockSkew != null ? clockSkew : Duration.ZERO;
    }

    public boolean has(JwtValidationOption option) {
        return options.contains(option);
    }
}
