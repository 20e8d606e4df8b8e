package wattle.core.service.backchannel;

import java.util.EnumSet;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.model.backchannel.BackChannelAuthenticationRequest;
import wattle.core.model.client.BackChannelTokenDeliveryMode;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.service.grant.GrantResults;

/**
 * Push mode: tokens are delivered to the client's notification endpoint, so the token
 * endpoint never hands them out.
 */
@ApplicationScoped
public class PushModeGrantProcessor implements BackChannelGrantProcessor {

    private static final Logger LOG = Logger.getLogger(PushModeGrantProcessor.class);

    @Override
    public Set<BackChannelTokenDeliveryMode> deliveryModes() {
        return EnumSet.of(BackChannelTokenDeliveryMode.PUSH);
    }

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> process(String requestId, BackChannelAuthenticationRequest request) {
        LOG.warnv("Push mode client {0} polled the token endpoint for request {1}", request.clientId(), requestId);
        return GrantResults.errorUni(
                ErrorCodes.INVALID_GRANT, "Clients using the push token delivery mode must not poll the token endpoint");
    }
}
