package wattle.core.service.grant;

import java.net.URI;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;

import wattle.core.config.EndpointConfig;
import wattle.core.config.JwtBearerConfig;
import wattle.core.model.client.ClientInfo;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.GrantTypes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthSession;
import wattle.core.model.grant.AuthorizationContext;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenRequest;
import wattle.core.model.jwt.JsonWebToken;
import wattle.core.model.jwt.JwtValidationOption;
import wattle.core.model.jwt.JwtValidationParameters;
import wattle.core.model.jwt.JwtValidationResult;
import wattle.core.model.jwt.TrustedIssuer;
import wattle.core.port.in.AuthorizationGrantHandler;
import wattle.core.port.out.GrantMetrics;
import wattle.core.port.out.JsonWebTokenValidator;
import wattle.core.port.out.JwtReplayCache;
import wattle.core.port.out.RequestInfoProvider;
import wattle.core.service.common.ParameterValidator;
import wattle.core.service.common.RandomValueGenerator;
import wattle.core.service.jwtbearer.JwtBearerIssuerProvider;
import wattle.core.util.UriMatcher;

/**
 * Token requests using a JWT issued by a trusted third party as the grant (RFC 7523).
 *
 * <p>Checks run in a fixed order and stop at the first failure:
 * <ol>
 * <li>assertion size</li>
 * <li>signature, lifetime, issuer trust and audience</li>
 * <li>subject and issuer configuration</li>
 * <li>signing algorithm</li>
 * <li>{@code typ} header, when restricted</li>
 * <li>maximum age of {@code iat}, when configured</li>
 * <li>{@code jti} replay, when required</li>
 * <li>scope restrictions of the issuer</li>
 * </ol>
 *
 * <p>Rejections are logged with full context but reported to the caller with generic
 * descriptions. Two concurrent requests with the same {@code jti} may both pass the replay
 * check before either marks it used; the storage offers no set-if-absent primitive.
 */
@ApplicationScoped
public class JwtBearerGrantHandler implements AuthorizationGrantHandler {

    private static final Logger LOG = Logger.getLogger(JwtBearerGrantHandler.class);

    private static final String INVALID_ASSERTION = "The assertion is not valid";

    private final JsonWebTokenValidator validator;
    private final JwtBearerIssuerProvider issuerProvider;
    private final JwtReplayCache replayCache;
    private final RequestInfoProvider requestInfo;
    private final RandomValueGenerator randomValueGenerator;
    private final GrantMetrics metrics;
    private final JwtBearerConfig config;
    private final EndpointConfig endpointConfig;
    private final Clock clock;

    @Inject
    public JwtBearerGrantHandler(
            JsonWebTokenValidator validator,
            JwtBearerIssuerProvider issuerProvider,
            JwtReplayCache replayCache,
            RequestInfoProvider requestInfo,
            RandomValueGenerator randomValueGenerator,
            GrantMetrics metrics,
            JwtBearerConfig config,
            EndpointConfig endpointConfig,
            Clock clock) {
        this.validator = validator;
        this.issuerProvider = issuerProvider;
        this.replayCache = replayCache;
        this.requestInfo = requestInfo;
        this.randomValueGenerator = randomValueGenerator;
        this.metrics = metrics;
        this.config = config;
        this.endpointConfig = endpointConfig;
        this.clock = clock;
    }

    @Override
    public Set<String> grantTypesSupported() {
        return Set.of(GrantTypes.JWT_BEARER);
    }

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> authorize(TokenRequest request, ClientInfo clientInfo) {
        final var assertion = ParameterValidator.required(request.assertion(), "assertion");
        if (assertion.length() > config.maxJwtSize()) {
            LOG.warnv(
                    "JWT bearer assertion rejected: size {0} exceeds {1} (client={2}, ip={3})",
                    assertion.length(),
                    config.maxJwtSize(),
                    clientInfo.clientId(),
                    requestInfo.remoteIpAddress());
            return GrantResults.errorUni(ErrorCodes.INVALID_GRANT, INVALID_ASSERTION);
        }

        return validator.validate(assertion, validationParameters()).flatMap(result -> {
            if (result instanceof JwtValidationResult.Invalid invalid) {
                if (invalid.token() != null) {
                    return reject(invalid.token(), clientInfo, invalid.error() + " " + invalid.description());
                }
                LOG.warnv(
                        "JWT bearer assertion rejected: {0} {1} (client={2}, ip={3})",
                        invalid.error(),
                        invalid.description(),
                        clientInfo.clientId(),
                        requestInfo.remoteIpAddress());
                return GrantResults.errorUni(ErrorCodes.INVALID_GRANT, INVALID_ASSERTION);
            }
            return authorizeValidated(((JwtValidationResult.Valid) result).token(), request, clientInfo);
        });
    }

    private Uni<Result<AuthorizedGrant, OidcError>> authorizeValidated(
            JsonWebToken token, TokenRequest request, ClientInfo clientInfo) {
        if (token.subject() == null || token.subject().isBlank()) {
            return reject(token, clientInfo, "missing subject");
        }

        final var trusted = issuerProvider.findTrustedIssuer(token.issuer());
        if (trusted.isEmpty()) {
            return reject(token, clientInfo, "issuer is not configured");
        }
        final var issuer = trusted.get();

        final var algorithms = allowedAlgorithms(issuer, clientInfo);
        if (!algorithms.contains(token.algorithm())) {
            return reject(token, clientInfo, "algorithm " + token.algorithm() + " is not allowed");
        }

        final var allowedTypes = config.allowedTokenTypes().orElse(List.of());
        if (!allowedTypes.isEmpty()
                && (token.type() == null || allowedTypes.stream().noneMatch(token.type()::equalsIgnoreCase))) {
            return reject(token, clientInfo, "token type " + token.type() + " is not allowed");
        }

        if (config.maxJwtAge().isPresent()) {
            if (token.issuedAt() == null) {
                return reject(token, clientInfo, "missing iat");
            }
            final var oldest = clock.instant().minus(config.maxJwtAge().get()).minus(config.clockSkew());
            if (token.issuedAt().isBefore(oldest)) {
                return reject(token, clientInfo, "token is older than the maximum age");
            }
        }

        return checkReplay(token, clientInfo).flatMap(replayError -> {
            if (replayError != null) {
                return Uni.createFrom().item(replayError);
            }
            return Uni.createFrom().item(authorizeScope(token, issuer, request, clientInfo));
        });
    }

    private Uni<Result<AuthorizedGrant, OidcError>> checkReplay(JsonWebToken token, ClientInfo clientInfo) {
        if (!config.requireJti()) {
            return Uni.createFrom().nullItem();
        }
        if (token.jwtId() == null || token.jwtId().isBlank()) {
            return reject(token, clientInfo, "missing jti");
        }
        return replayCache.isReplayed(token.jwtId()).flatMap(replayed -> {
            if (replayed) {
                metrics.recordReplayDetected(token.issuer());
                LOG.warnv(
                        "SECURITY: JWT bearer assertion replay detected (client={0}, issuer={1}, jti={2}, ip={3})",
                        clientInfo.clientId(),
                        token.issuer(),
                        token.jwtId(),
                        requestInfo.remoteIpAddress());
                return GrantResults.errorUni(ErrorCodes.INVALID_GRANT, INVALID_ASSERTION);
            }
            return replayCache
                    .markAsUsed(token.jwtId(), token.expiresAt())
                    .replaceWith(Uni.createFrom().<Result<AuthorizedGrant, OidcError>>nullItem());
        });
    }

    private Result<AuthorizedGrant, OidcError> authorizeScope(
            JsonWebToken token, TrustedIssuer issuer, TokenRequest request, ClientInfo clientInfo) {
        if (!issuer.allowedScopes().isEmpty()) {
            final var denied = request.scope().stream()
                    .filter(scope -> !issuer.allowedScopes().contains(scope))
                    .toList();
            if (!denied.isEmpty()) {
                LOG.warnv(
                        "JWT bearer assertion rejected: scopes {0} not allowed for issuer {1} (client={2}, jti={3})",
                        denied,
                        token.issuer(),
                        clientInfo.clientId(),
                        token.jwtId());
                return GrantResults.error(
                        ErrorCodes.INVALID_SCOPE, "The requested scope is not allowed: " + String.join(" ", denied));
            }
        }

        final var session = AuthSession.of(
                token.subject(),
                randomValueGenerator.newSessionId(),
                clock.instant(),
                token.issuer(),
                clientInfo.clientId());
        final var context = AuthorizationContext.of(clientInfo.clientId(), request.scope())
                .withResources(request.resources());

        LOG.infov(
                "AUDIT: JWT bearer grant accepted (client={0}, issuer={1}, subject={2}, jti={3}, ip={4})",
                clientInfo.clientId(),
                token.issuer(),
                token.subject(),
                token.jwtId(),
                requestInfo.remoteIpAddress());
        return GrantResults.granted(new AuthorizedGrant(session, context));
    }

    private Uni<Result<AuthorizedGrant, OidcError>> reject(JsonWebToken token, ClientInfo clientInfo, String reason) {
        LOG.warnv(
                "JWT bearer assertion rejected: {0} (client={1}, issuer={2}, jti={3}, kid={4}, ip={5})",
                reason,
                clientInfo.clientId(),
                token.issuer(),
                token.jwtId(),
                token.keyId(),
                requestInfo.remoteIpAddress());
        return GrantResults.errorUni(ErrorCodes.INVALID_GRANT, INVALID_ASSERTION);
    }

    private Set<String> allowedAlgorithms(TrustedIssuer issuer, ClientInfo clientInfo) {
        if (!issuer.allowedAlgorithms().isEmpty()) {
            return issuer.allowedAlgorithms();
        }
        if (!clientInfo.jwtBearerAllowedAlgorithms().isEmpty()) {
            return clientInfo.jwtBearerAllowedAlgorithms();
        }
        return Set.copyOf(config.defaultAllowedAlgorithms());
    }

    private JwtValidationParameters validationParameters() {
        return new JwtValidationParameters(
                EnumSet.of(
                        JwtValidationOption.VALIDATE_LIFETIME,
                        JwtValidationOption.VALIDATE_ISSUER,
                        JwtValidationOption.VALIDATE_AUDIENCE,
                        JwtValidationOption.REQUIRE_SIGNED_TOKENS),
                issuerProvider::isTrusted,
                audiences -> Uni.createFrom().item(audiences.stream().anyMatch(this::isAcceptedAudience)),
                this::resolveSigningKeys,
                config.clockSkew());
    }

    private Uni<List<JsonWebKey>> resolveSigningKeys(JsonWebToken token) {
        return issuerProvider.getSigningKeys(token.issuer(), token.keyId()).onFailure().recoverWithItem(failure -> {
            LOG.warnv(failure, "Signing keys of issuer {0} are unavailable", token.issuer());
            return List.of();
        });
    }

    boolean isAcceptedAudience(String audience) {
        final var applicationUri = requestInfo.applicationUri();
        if (UriMatcher.matches(audience, tokenEndpoint(applicationUri), true)) {
            return true;
        }
        return !config.strictAudienceValidation() && UriMatcher.matches(audience, applicationUri, true);
    }

    private URI tokenEndpoint(URI applicationUri) {
        final var base = applicationUri.toString().endsWith("/") ? applicationUri.toString() : applicationUri + "/";
        final var path = endpointConfig.tokenPath().startsWith("/")
                ? endpointConfig.tokenPath().substring(1)
                : endpointConfig.tokenPath();
        return URI.create(base).resolve(path);
    }
}
