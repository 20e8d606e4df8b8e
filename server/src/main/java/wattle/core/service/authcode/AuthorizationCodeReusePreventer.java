package wattle.core.service.authcode;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenInfo;
import wattle.core.model.jwt.TokenStatus;
import wattle.core.port.out.TokenRegistry;
import wattle.core.service.grant.GrantResults;

/**
 * Detects redemption of an authorization code that already produced tokens.
 *
 * <p>Per RFC 6749 section 4.1.2, a reused code is revoked together with every token
 * previously issued from it.
 */
@ApplicationScoped
public class AuthorizationCodeReusePreventer {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeReusePreventer.class);

    private final AuthorizationCodeService codeService;
    private final TokenRegistry tokenRegistry;

    @Inject
    public AuthorizationCodeReusePreventer(AuthorizationCodeService codeService, TokenRegistry tokenRegistry) {
        this.codeService = codeService;
        this.tokenRegistry = tokenRegistry;
    }

    /**
     * Accepts the first redemption of a code and rejects later ones.
     *
     * @param code  the redeemed code
     * @param grant the grant stored under the code
     * @return the grant, or {@code invalid_grant} when tokens were already issued from it
     */
    public Uni<Result<AuthorizedGrant, OidcError>> redeem(String code, AuthorizedGrant grant) {
        if (grant.issuedTokens().isEmpty()) {
            return GrantResults.grantedUni(grant);
        }

        LOG.warnv(
                "SECURITY: Authorization code reuse detected for client {0}, revoking {1} issued tokens",
                grant.context().clientId(),
                grant.issuedTokens().size());

        return codeService
                .removeAuthorizationCode(code)
                .flatMap(removed -> revoke(grant.issuedTokens()))
                .replaceWith(GrantResults.error(ErrorCodes.INVALID_GRANT, "The authorization code was already used"));
    }

    /**
     * Records tokens issued from a code so a later redemption can revoke them.
     */
    public Uni<Void> recordIssuedTokens(String code, AuthorizedGrant grant, List<TokenInfo> tokens) {
        return codeService.updateAuthorizationGrant(code, grant.withIssuedTokens(tokens));
    }

    private Uni<Void> revoke(List<TokenInfo> tokens) {
        return Multi.createFrom()
                .iterable(tokens)
                .onItem()
                .transformToUniAndConcatenate(
                        token -> tokenRegistry.setStatus(token.jwtId(), TokenStatus.REVOKED, token.expiresAt()))
                .collect()
                .asList()
                .replaceWithVoid();
    }
}
