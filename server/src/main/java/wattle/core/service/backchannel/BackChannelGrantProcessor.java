package wattle.core.service.backchannel;

import java.util.Set;

import io.smallrye.mutiny.Uni;

import wattle.core.model.backchannel.BackChannelAuthenticationRequest;
import wattle.core.model.client.BackChannelTokenDeliveryMode;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizedGrant;

/**
 * Finalizes an authenticated backchannel request for a token delivery mode.
 */
public interface BackChannelGrantProcessor {

    /**
     * Delivery modes this processor handles.
     */
    Set<BackChannelTokenDeliveryMode> deliveryModes();

    /**
     * Produces the token endpoint outcome for an authenticated request.
     *
     * @param requestId the {@code auth_req_id}
     * @param request   the stored request, status {@code AUTHENTICATED}
     */
    Uni<Result<AuthorizedGrant, OidcError>> process(String requestId, BackChannelAuthenticationRequest request);
}
