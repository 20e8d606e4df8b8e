package wattle.core.service.grant;

import java.util.EnumSet;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.config.TokenConfig;
import wattle.core.model.client.ClientInfo;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.GrantTypes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenRequest;
import wattle.core.model.jwt.JsonWebToken;
import wattle.core.model.jwt.JwtTypes;
import wattle.core.model.jwt.JwtValidationOption;
import wattle.core.model.jwt.JwtValidationParameters;
import wattle.core.model.jwt.JwtValidationResult;
import wattle.core.model.jwt.TokenStatus;
import wattle.core.port.in.AuthorizationGrantHandler;
import wattle.core.port.out.JsonWebTokenValidator;
import wattle.core.port.out.SigningKeyProvider;
import wattle.core.port.out.TokenRegistry;
import wattle.core.service.common.ParameterValidator;
import wattle.core.service.token.RefreshTokenService;

/**
 * Token requests presenting a refresh token issued by this server.
 */
@ApplicationScoped
public class RefreshTokenGrantHandler implements AuthorizationGrantHandler {

    private static final Logger LOG = Logger.getLogger(RefreshTokenGrantHandler.class);

    private final JsonWebTokenValidator validator;
    private final SigningKeyProvider keyProvider;
    private final RefreshTokenService refreshTokenService;
    private final TokenRegistry tokenRegistry;
    private final TokenConfig config;

    @Inject
    public RefreshTokenGrantHandler(
            JsonWebTokenValidator validator,
            SigningKeyProvider keyProvider,
            RefreshTokenService refreshTokenService,
            TokenRegistry tokenRegistry,
            TokenConfig config) {
        this.validator = validator;
        this.keyProvider = keyProvider;
        this.refreshTokenService = refreshTokenService;
        this.tokenRegistry = tokenRegistry;
        this.config = config;
    }

    @Override
    public Set<String> grantTypesSupported() {
        return Set.of(GrantTypes.REFRESH_TOKEN);
    }

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> authorize(TokenRequest request, ClientInfo clientInfo) {
        final var refreshToken = ParameterValidator.required(request.refreshToken(), "refresh_token");

        return validator.validate(refreshToken, validationParameters()).flatMap(result -> {
            if (result instanceof JwtValidationResult.Invalid invalid) {
                LOG.debugf("Refresh token rejected for client %s: %s", clientInfo.clientId(), invalid.description());
                return GrantResults.errorUni(ErrorCodes.INVALID_GRANT, invalid.description());
            }

            final var token = ((JwtValidationResult.Valid) result).token();
            if (!JwtTypes.REFRESH_TOKEN.equals(token.type())) {
                return GrantResults.errorUni(ErrorCodes.INVALID_GRANT, "The token is not a refresh token");
            }

            return checkNotRevoked(token).map(revoked -> {
                if (revoked) {
                    LOG.warnv(
                            "SECURITY: Revoked refresh token {0} presented by client {1}",
                            token.jwtId(),
                            clientInfo.clientId());
                    return GrantResults.error(ErrorCodes.INVALID_GRANT, "The refresh token was revoked");
                }
                return authorizeFor(token, clientInfo);
            });
        });
    }

    private Result<AuthorizedGrant, OidcError> authorizeFor(JsonWebToken token, ClientInfo clientInfo) {
        final var restored = refreshTokenService.authorizeByRefreshToken(token);
        if (restored.isFailure()) {
            return restored;
        }
        final var grant = restored.getSuccess();
        if (!grant.context().clientId().equals(clientInfo.clientId())) {
            LOG.warnv(
                    "Client {0} presented a refresh token issued to client {1}",
                    clientInfo.clientId(),
                    grant.context().clientId());
            return GrantResults.error(ErrorCodes.INVALID_GRANT, "The refresh token was issued to another client");
        }
        return restored;
    }

    private Uni<Boolean> checkNotRevoked(JsonWebToken token) {
        if (token.jwtId() == null) {
            return Uni.createFrom().item(false);
        }
        return tokenRegistry.getStatus(token.jwtId())
                .map(status -> status.filter(s -> s == TokenStatus.REVOKED).isPresent());
    }

    private JwtValidationParameters validationParameters() {
        return new JwtValidationParameters(
                EnumSet.of(
                        JwtValidationOption.VALIDATE_LIFETIME,
                        JwtValidationOption.VALIDATE_ISSUER,
                        JwtValidationOption.REQUIRE_SIGNED_TOKENS),
                issuer -> Uni.createFrom().item(config.issuer().equals(issuer)),
                null,
                token -> Uni.createFrom().item(keyProvider.verificationKeys()),
                config.clockSkew());
    }
}
