package wattle.core.service.grant;

import java.util.Objects;

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
import wattle.core.model.grant.TokenRequest;
import wattle.core.service.authcode.AuthorizationCodeReusePreventer;

/**
 * Entry point of the token endpoint: client permission, grant dispatch and the checks
 * that apply to the resulting grant.
 */
@ApplicationScoped
public class AuthorizationGrantValidator {

    private static final Logger LOG = Logger.getLogger(AuthorizationGrantValidator.class);

    private final CompositeAuthorizationGrantHandler grantHandler;
    private final AuthorizationCodeReusePreventer reusePreventer;

    @Inject
    public AuthorizationGrantValidator(
            CompositeAuthorizationGrantHandler grantHandler, AuthorizationCodeReusePreventer reusePreventer) {
        this.grantHandler = grantHandler;
        this.reusePreventer = reusePreventer;
    }

    /**
     * Authorizes a token request for an authenticated client.
     *
     * <p>The allowed grant types of the client are only checked for grant types the server
     * supports, so unknown ones still yield {@code unsupported_grant_type}.
     */
    public Uni<Result<AuthorizedGrant, OidcError>> validate(TokenRequest request, ClientInfo clientInfo) {
        final var grantType = request.grantType();
        if (grantHandler.supports(grantType) && !clientInfo.isGrantTypeAllowed(grantType)) {
            LOG.debugf("Client %s is not allowed to use grant type %s", clientInfo.clientId(), grantType);
            return GrantResults.errorUni(
                    ErrorCodes.UNAUTHORIZED_CLIENT, "The client is not authorized to use the grant type " + grantType);
        }

        return grantHandler.authorize(request, clientInfo).flatMap(result -> {
            if (result.isFailure()) {
                return Uni.createFrom().item(result);
            }

            final var grant = result.getSuccess();
            final var expectedRedirectUri = grant.context().redirectUri();
            if (expectedRedirectUri != null && !Objects.equals(expectedRedirectUri, request.redirectUri())) {
                LOG.warnv(
                        "Redirect URI {0} does not match {1} for client {2}",
                        request.redirectUri(),
                        expectedRedirectUri,
                        clientInfo.clientId());
                return GrantResults.errorUni(ErrorCodes.INVALID_GRANT, "The redirect URI does not match");
            }

            if (GrantTypes.AUTHORIZATION_CODE.equalsIgnoreCase(grantType)) {
                return reusePreventer.redeem(request.code(), grant);
            }
            return Uni.createFrom().item(result);
        });
    }
}
