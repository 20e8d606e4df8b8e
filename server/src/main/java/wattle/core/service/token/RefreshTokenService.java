package wattle.core.service.token;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;

import wattle.core.config.TokenConfig;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthSession;
import wattle.core.model.grant.AuthorizationContext;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.IssuedRefreshToken;
import wattle.core.model.grant.TokenInfo;
import wattle.core.model.jwt.JsonWebToken;
import wattle.core.model.jwt.JwtTypes;
import wattle.core.model.jwt.TokenStatus;
import wattle.core.port.out.JsonWebTokenSigner;
import wattle.core.port.out.TokenRegistry;
import wattle.core.service.grant.GrantResults;

/**
 * Creates self-contained refresh tokens and rebuilds grants from them.
 *
 * <p>The token carries everything needed to restore the grant, so nothing is stored
 * except the token status in {@link TokenRegistry}.
 */
@ApplicationScoped
public class RefreshTokenService {

    private static final Logger LOG = Logger.getLogger(RefreshTokenService.class);

    static final String CLAIM_SESSION_ID = "sid";
    static final String CLAIM_AUTH_TIME = "auth_time";
    static final String CLAIM_IDENTITY_PROVIDER = "idp";
    static final String CLAIM_CLIENT_ID = "client_id";
    static final String CLAIM_SCOPE = "scope";
    static final String CLAIM_ACR = "acr";
    static final String CLAIM_AMR = "amr";
    static final String CLAIM_RESOURCE = "resource";

    private final TokenConfig config;
    private final JsonWebTokenSigner signer;
    private final TokenRegistry tokenRegistry;
    private final Clock clock;

    @Inject
    public RefreshTokenService(
            TokenConfig config, JsonWebTokenSigner signer, TokenRegistry tokenRegistry, Clock clock) {
        this.config = config;
        this.signer = signer;
        this.tokenRegistry = tokenRegistry;
        this.clock = clock;
    }

    /**
     * Signs a refresh token for the grant and registers it as active.
     */
    public Uni<IssuedRefreshToken> createRefreshToken(AuthorizedGrant grant) {
        final var session = grant.authSession();
        final var context = grant.context();
        final var now = clock.instant();
        final var expiresAt = now.plus(config.refreshTokenLifetime());

        final var claims = new JwtClaims();
        claims.setIssuer(config.issuer());
        claims.setSubject(session.subject());
        claims.setAudience(config.issuer());
        claims.setIssuedAt(NumericDate.fromMilliseconds(now.toEpochMilli()));
        claims.setNotBefore(NumericDate.fromMilliseconds(now.toEpochMilli()));
        claims.setExpirationTime(NumericDate.fromMilliseconds(expiresAt.toEpochMilli()));
        claims.setGeneratedJwtId();
        claims.setClaim(CLAIM_SESSION_ID, session.sessionId());
        claims.setClaim(CLAIM_AUTH_TIME, session.authenticationTime().getEpochSecond());
        claims.setClaim(CLAIM_CLIENT_ID, context.clientId());
        if (session.identityProvider() != null) {
            claims.setClaim(CLAIM_IDENTITY_PROVIDER, session.identityProvider());
        }
        if (!context.scope().isEmpty()) {
            claims.setClaim(CLAIM_SCOPE, String.join(" ", context.scope()));
        }
        if (session.authContextClassRef() != null) {
            claims.setClaim(CLAIM_ACR, session.authContextClassRef());
        }
        if (!session.authenticationMethods().isEmpty()) {
            claims.setStringListClaim(CLAIM_AMR, session.authenticationMethods());
        }
        if (!context.resources().isEmpty()) {
            claims.setStringListClaim(
                    CLAIM_RESOURCE,
                    context.resources().stream().map(Object::toString).toList());
        }

        final var jwtId = claims.getClaimValueAsString("jti");
        final var value = signer.sign(claims, JwtTypes.REFRESH_TOKEN);
        final var info = new TokenInfo(jwtId, expiresAt);

        return tokenRegistry
                .setStatus(jwtId, TokenStatus.ACTIVE, expiresAt)
                .invoke(() -> LOG.debugf("Issued refresh token %s for client %s", jwtId, context.clientId()))
                .replaceWith(new IssuedRefreshToken(value, info));
    }

    /**
     * Restores the grant a validated refresh token was issued for.
     *
     * @return the grant, or {@code invalid_grant} when required claims are missing
     */
    public Result<AuthorizedGrant, OidcError> authorizeByRefreshToken(JsonWebToken token) {
        final var sessionId = token.stringClaim(CLAIM_SESSION_ID);
        final var clientId = token.stringClaim(CLAIM_CLIENT_ID);
        final var authTime = token.claims().get(CLAIM_AUTH_TIME);

        if (token.subject() == null || sessionId == null || clientId == null || !(authTime instanceof Number)) {
            LOG.warnv("Refresh token {0} is missing required claims", token.jwtId());
            return GrantResults.error(ErrorCodes.INVALID_GRANT, "Refresh token is not valid");
        }

        final var session = new AuthSession(
                token.subject(),
                sessionId,
                Instant.ofEpochSecond(((Number) authTime).longValue()),
                token.stringClaim(CLAIM_IDENTITY_PROVIDER),
                Set.of(clientId),
                token.stringClaim(CLAIM_ACR),
                stringList(token.claims().get(CLAIM_AMR)));

        final var scope = token.stringClaim(CLAIM_SCOPE);
        final var context = AuthorizationContext.of(
                        clientId, scope == null || scope.isBlank() ? List.of() : Arrays.asList(scope.split(" ")))
                .withResources(stringList(token.claims().get(CLAIM_RESOURCE)).stream()
                        .map(URI::create)
                        .toList());

        return GrantResults.granted(new AuthorizedGrant(session, context));
    }

    private static List<String> stringList(Object claim) {
        if (claim instanceof Collection<?> values) {
            final var result = new ArrayList<String>(values.size());
            values.forEach(value -> result.add(String.valueOf(value)));
            return result;
        }
        return claim != null ? List.of(claim.toString()) : List.of();
    }
}
