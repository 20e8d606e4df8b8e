package wattle.core.service.grant;

import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import wattle.core.model.client.ClientInfo;
import wattle.core.model.common.GrantTypes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizationContext;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenRequest;
import wattle.core.port.in.AuthorizationGrantHandler;
import wattle.core.port.out.UserCredentialsAuthenticator;
import wattle.core.service.common.ParameterValidator;

/**
 * Token requests with resource owner password credentials (RFC 6749 section 4.3).
 */
@ApplicationScoped
public class PasswordGrantHandler implements AuthorizationGrantHandler {

    private final UserCredentialsAuthenticator authenticator;

    @Inject
    public PasswordGrantHandler(UserCredentialsAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    @Override
    public Set<String> grantTypesSupported() {
        return Set.of(GrantTypes.PASSWORD);
    }

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> authorize(TokenRequest request, ClientInfo clientInfo) {
        final var username = ParameterValidator.required(request.username(), "username");
        final var password = ParameterValidator.required(request.password(), "password");

        final var context = AuthorizationContext.of(clientInfo.clientId(), request.scope())
                .withResources(request.resources());
        return authenticator.validate(username, password, context);
    }
}
