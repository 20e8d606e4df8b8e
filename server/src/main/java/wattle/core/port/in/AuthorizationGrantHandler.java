package wattle.core.port.in;

import java.util.Set;

import io.smallrye.mutiny.Uni;

import wattle.core.model.client.ClientInfo;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenRequest;

/**
 * Decides whether an authenticated client may receive tokens for a token request.
 *
 * <p>Each implementation handles one or more grant types. Expected rejections are
 * returned as {@link Result.Failure} values carrying an OAuth error code; the returned
 * {@link Uni} only fails on infrastructure errors or broken invariants.
 */
public interface AuthorizationGrantHandler {

    /**
     * Grant type identifiers this handler processes.
     */
    Set<String> grantTypesSupported();

    /**
     * Authorizes a token request.
     *
     * @param request    the token request
     * @param clientInfo the authenticated client
     * @return the authorized grant, or the OAuth error to return to the client
     */
    Uni<Result<AuthorizedGrant, OidcError>> authorize(TokenRequest request, ClientInfo clientInfo);
}
