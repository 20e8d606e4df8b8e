package wattle.adapter.out.auth;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizationContext;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.port.out.UserCredentialsAuthenticator;
import wattle.core.service.grant.GrantResults;

/**
 * Authenticator used until the application provides a user store. Rejects every credential.
 */
@DefaultBean
@ApplicationScoped
public class RejectingUserCredentialsAuthenticator implements UserCredentialsAuthenticator {

    private static final Logger LOG = Logger.getLogger(RejectingUserCredentialsAuthenticator.class);

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> validate(
            String username, String password, AuthorizationContext context) {
        LOG.debugf("No user store configured, rejecting password grant for client %s", context.clientId());
        return GrantResults.errorUni(ErrorCodes.INVALID_GRANT, "Invalid username or password");
    }
}
