package wattle.core.port.out;

import io.smallrye.mutiny.Uni;

import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizationContext;
import wattle.core.model.grant.AuthorizedGrant;

/**
 * Port verifying resource owner credentials for the password grant.
 */
public interface UserCredentialsAuthenticator {

    /**
     * Verifies a username and password.
     *
     * @param username the resource owner's username
     * @param password the resource owner's password
     * @param context  client and scope of the request
     * @return the authorized grant, or the OAuth error to return
     */
    Uni<Result<AuthorizedGrant, OidcError>> validate(String username, String password, AuthorizationContext context);
}
