package wattle.core.model.jwt;

import java.net.URI;
import java.util.Set;

/**
 * An external issuer whose JWT assertions the server accepts as authorization grants.
 *
 * @param issuer            expected {@code iss} value
 * @param jwksUri           where the issuer publishes its signing keys
 * @param allowedAlgorithms signing algorithms accepted from this issuer, empty for the defaults
 * @param allowedScopes     scope values this issuer may request, empty for no restriction
 */
public record TrustedIssuer(String issuer, URI jwksUri, Set<String> allowedAlgorithms, Set<String> allowedScopes) {

    public TrustedIssuer {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer cannot be null or blank");
        }
        if (jwksUri == null) {
            throw new IllegalArgumentException("JWKS URI cannot be null");
        }
        allowedAlgorithms = allowedAlgorithms != null ? Set.copyOf(allowedAlgorithms) : Set.of();
        allowedScopes = allowedScopes != null ? Set.copyOf(allowedScopes) : Set.of();
    }
}
