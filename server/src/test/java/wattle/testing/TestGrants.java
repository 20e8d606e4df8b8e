package wattle.testing;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import wattle.core.model.client.ClientInfo;
import wattle.core.model.grant.AuthSession;
import wattle.core.model.grant.AuthorizationContext;
import wattle.core.model.grant.AuthorizedGrant;

/**
 * Fixtures shared by grant handler tests.
 */
public final class TestGrants {

    private TestGrants() {}

    public static AuthSession session(String subject, String clientId) {
        return AuthSession.of(subject, "sid-" + subject, Instant.parse("2024-01-01T00:00:00Z"), "local", clientId);
    }

    public static AuthorizedGrant grant(String clientId) {
        return new AuthorizedGrant(session("alice", clientId), AuthorizationContext.of(clientId, List.of("openid")));
    }

    public static ClientInfo client(String clientId, String... grantTypes) {
        return ClientInfo.of(clientId, Set.of(grantTypes));
    }
}
