package wattle.core.service.grant;

import java.time.Clock;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import wattle.core.model.client.ClientInfo;
import wattle.core.model.common.GrantTypes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthSession;
import wattle.core.model.grant.AuthorizationContext;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenRequest;
import wattle.core.port.in.AuthorizationGrantHandler;
import wattle.core.service.common.RandomValueGenerator;

/**
 * Token requests where the client acts on its own behalf (RFC 6749 section 4.4).
 *
 * <p>The session subject is the client itself.
 */
@ApplicationScoped
public class ClientCredentialsGrantHandler implements AuthorizationGrantHandler {

    private final RandomValueGenerator randomValueGenerator;
    private final Clock clock;

    @Inject
    public ClientCredentialsGrantHandler(RandomValueGenerator randomValueGenerator, Clock clock) {
        this.randomValueGenerator = randomValueGenerator;
        this.clock = clock;
    }

    @Override
    public Set<String> grantTypesSupported() {
        return Set.of(GrantTypes.CLIENT_CREDENTIALS);
    }

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> authorize(TokenRequest request, ClientInfo clientInfo) {
        final var session = AuthSession.of(
                clientInfo.clientId(),
                randomValueGenerator.newSessionId(),
                clock.instant(),
                GrantTypes.CLIENT_CREDENTIALS,
                clientInfo.clientId());
        final var context = AuthorizationContext.of(clientInfo.clientId(), request.scope())
                .withResources(request.resources());
        return GrantResults.grantedUni(new AuthorizedGrant(session, context));
    }
}
