package wattle.core.service.grant;

import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.model.client.ClientInfo;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.GrantTypes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.CodeChallengeMethods;
import wattle.core.model.grant.TokenRequest;
import wattle.core.port.in.AuthorizationGrantHandler;
import wattle.core.service.authcode.AuthorizationCodeService;
import wattle.core.service.common.ParameterValidator;
import wattle.core.service.pkce.CodeChallengeCalculator;

/**
 * Token requests redeeming an authorization code, with PKCE verification (RFC 7636).
 *
 * <p>The code is read without being consumed; single use is enforced after a successful
 * redemption by {@link wattle.core.service.authcode.AuthorizationCodeReusePreventer}.
 */
@ApplicationScoped
public class AuthorizationCodeGrantHandler implements AuthorizationGrantHandler {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeGrantHandler.class);

    private final AuthorizationCodeService codeService;
    private final CodeChallengeCalculator challengeCalculator;

    @Inject
    public AuthorizationCodeGrantHandler(
            AuthorizationCodeService codeService, CodeChallengeCalculator challengeCalculator) {
        this.codeService = codeService;
        this.challengeCalculator = challengeCalculator;
    }

    @Override
    public Set<String> grantTypesSupported() {
        return Set.of(GrantTypes.AUTHORIZATION_CODE);
    }

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> authorize(TokenRequest request, ClientInfo clientInfo) {
        final var code = ParameterValidator.required(request.code(), "code");

        return codeService.authorizeByCode(code).map(found -> {
            if (found.isEmpty()) {
                LOG.debugf("Unknown or expired authorization code presented by client %s", clientInfo.clientId());
                return GrantResults.error(ErrorCodes.INVALID_GRANT, "Authorization code is invalid");
            }

            final var grant = found.get();
            final var context = grant.context();
            if (!context.clientId().equals(clientInfo.clientId())) {
                LOG.warnv(
                        "Client {0} presented an authorization code issued to client {1}",
                        clientInfo.clientId(),
                        context.clientId());
                return GrantResults.error(ErrorCodes.UNAUTHORIZED_CLIENT, "Code was issued for another client");
            }

            if (context.codeChallenge() != null) {
                if (request.codeVerifier() == null || request.codeVerifier().isBlank()) {
                    return GrantResults.error(ErrorCodes.INVALID_GRANT, "Code verifier is required");
                }
                final var method = context.codeChallengeMethod() != null
                        ? context.codeChallengeMethod()
                        : CodeChallengeMethods.PLAIN;
                if (!challengeCalculator.matches(context.codeChallenge(), method, request.codeVerifier())) {
                    LOG.warnv("PKCE verification failed for client {0}", clientInfo.clientId());
                    return GrantResults.error(ErrorCodes.INVALID_GRANT, "Code verifier is not valid");
                }
            }

            return GrantResults.granted(grant);
        });
    }
}
