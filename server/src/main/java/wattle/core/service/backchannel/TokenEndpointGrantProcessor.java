package wattle.core.service.backchannel;

import java.util.EnumSet;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

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
 * Poll and ping modes: tokens are fetched from the token endpoint, once.
 *
 * <p>The request is claimed by removing it; only the caller whose removal succeeds
 * receives the grant, so concurrent token requests cannot both obtain tokens.
 */
@ApplicationScoped
public class TokenEndpointGrantProcessor implements BackChannelGrantProcessor {

    private static final Logger LOG = Logger.getLogger(TokenEndpointGrantProcessor.class);

    private final BackChannelAuthenticationStorage storage;

    @Inject
    public TokenEndpointGrantProcessor(BackChannelAuthenticationStorage storage) {
        this.storage = storage;
    }

    @Override
    public Set<BackChannelTokenDeliveryMode> deliveryModes() {
        return EnumSet.of(BackChannelTokenDeliveryMode.POLL, BackChannelTokenDeliveryMode.PING);
    }

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> process(String requestId, BackChannelAuthenticationRequest request) {
        return storage.tryRemove(requestId).map(removed -> {
            if (!removed) {
                LOG.debugf("Authentication request %s was consumed concurrently", requestId);
                return GrantResults.error(
                        ErrorCodes.EXPIRED_TOKEN, "The authentication request has expired or was already used");
            }
            return GrantResults.granted(request.authorizedGrant());
        });
    }
}
