package wattle.core.service.jwtbearer;

import java.net.URI;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;

import wattle.core.config.JwtBearerConfig;
import wattle.core.model.jwt.TrustedIssuer;
import wattle.core.port.out.JwksCache;
import wattle.core.util.UriMatcher;

/**
 * Resolves the issuers trusted to sign JWT bearer assertions and their signing keys.
 */
@ApplicationScoped
public class JwtBearerIssuerProvider {

    private static final Logger LOG = Logger.getLogger(JwtBearerIssuerProvider.class);

    private final List<TrustedIssuer> trustedIssuers;
    private final JwksCache jwksCache;

    @Inject
    public JwtBearerIssuerProvider(JwtBearerConfig config, JwksCache jwksCache) {
        this(toTrustedIssuers(config), jwksCache);
    }

    public JwtBearerIssuerProvider(List<TrustedIssuer> trustedIssuers, JwksCache jwksCache) {
        this.trustedIssuers = List.copyOf(trustedIssuers);
        this.jwksCache = jwksCache;
        LOG.infof("Trusting %d JWT bearer issuers", this.trustedIssuers.size());
    }

    /**
     * Finds the trusted issuer an {@code iss} value designates.
     */
    public Optional<TrustedIssuer> findTrustedIssuer(String issuer) {
        if (issuer == null || issuer.isBlank()) {
            return Optional.empty();
        }
        return trustedIssuers.stream()
                .filter(trusted -> UriMatcher.matches(issuer, URI.create(trusted.issuer()), false))
                .findFirst();
    }

    public Uni<Boolean> isTrusted(String issuer) {
        return Uni.createFrom().item(findTrustedIssuer(issuer).isPresent());
    }

    /**
     * Returns the signature keys published by a trusted issuer; empty for untrusted issuers.
     *
     * @param issuer the {@code iss} of the token
     * @param keyId  the {@code kid} of the token, may be null
     */
    public Uni<List<JsonWebKey>> getSigningKeys(String issuer, String keyId) {
        final var trusted = findTrustedIssuer(issuer);
        if (trusted.isEmpty()) {
            LOG.debugf("No signing keys for untrusted issuer %s", issuer);
            return Uni.createFrom().item(List.of());
        }
        return jwksCache.getSigningKeys(trusted.get().jwksUri(), keyId);
    }

    private static List<TrustedIssuer> toTrustedIssuers(JwtBearerConfig config) {
        return config.trustedIssuers().values().stream()
                .map(issuer -> new TrustedIssuer(
                        issuer.issuer(),
                        issuer.jwksUri(),
                        new HashSet<>(issuer.allowedAlgorithms().orElse(List.of())),
                        new HashSet<>(issuer.allowedScopes().orElse(List.of()))))
                .toList();
    }
}
