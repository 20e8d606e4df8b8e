package wattle.core.model.backchannel;

import java.time.Instant;

import wattle.core.model.grant.AuthorizedGrant;

/**
 * Stored state of a CIBA authentication request, keyed by its {@code auth_req_id}.
 *
 * <p>The owning client is {@code authorizedGrant.context().clientId()}.
 *
 * @param authorizedGrant grant issued once the user authenticates
 * @param status          current status
 * @param expiresAt       when the request expires
 * @param nextPollAt      earliest time the client may poll again, null if never polled
 */
public record BackChannelAuthenticationRequest(
        AuthorizedGrant authorizedGrant, BackChannelAuthenticationStatus status, Instant expiresAt, Instant nextPollAt) {

    public BackChannelAuthenticationRequest {
        if (authorizedGrant == null) {
            throw new IllegalArgumentException("Authorized grant cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry cannot be null");
        }
    }

    public static BackChannelAuthenticationRequest pending(AuthorizedGrant grant, Instant expiresAt) {
        return new BackChannelAuthenticationRequest(grant, BackChannelAuthenticationStatus.PENDING, expiresAt, null);
    }

    public String clientId() {
        return authorizedGrant.context().clientId();
    }

    public BackChannelAuthenticationRequest withStatus(BackChannelAuthenticationStatus newStatus) {
        return new BackChannelAuthenticationRequest(authorizedGrant, newStatus, expiresAt, nextPollAt);
    }

    public BackChannelAuthenticationRequest withNextPollAt(Instant newNextPollAt) {
        return new BackChannelAuthenticationRequest(authorizedGrant, status, expiresAt, newNextPollAt);
    }

    public BackChannelAuthenticationRequest withAuthorizedGrant(AuthorizedGrant grant) {
        return new BackChannelAuthenticationRequest(grant, status, expiresAt, nextPollAt);
    }
}
