package wattle.core.model.grant;

import java.net.URI;
import java.util.List;

/**
 * What a client was authorized for: requested scope, redirect URI and PKCE challenge.
 *
 * @param clientId            client the authorization was granted to
 * @param scope               granted scope values
 * @param redirectUri         redirect URI of the authorization request, if any
 * @param codeChallenge       PKCE code challenge registered with the authorization request
 * @param codeChallengeMethod PKCE method ({@code plain}, {@code S256} or {@code S512})
 * @param resources           resource indicators of the request
 */
public record AuthorizationContext(
        String clientId,
        List<String> scope,
        URI redirectUri,
        String codeChallenge,
        String codeChallengeMethod,
        List<URI> resources) {

    public AuthorizationContext {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client ID cannot be null or blank");
        }
        scope = scope != null ? List.copyOf(scope) : List.of();
        resources = resources != null ? List.copyOf(resources) : List.of();
    }

    public static AuthorizationContext of(String clientId, List<String> scope) {
        return new AuthorizationContext(clientId, scope, null, null, null, List.of());
    }

    public AuthorizationContext withCodeChallenge(String challenge, String method) {
        return new AuthorizationContext(clientId, scope, redirectUri, challenge, method, resources);
    }

    public AuthorizationContext withRedirectUri(URI uri) {
        return new AuthorizationContext(clientId, scope, uri, codeChallenge, codeChallengeMethod, resources);
    }

    public AuthorizationContext withResources(List<URI> newResources) {
        return new AuthorizationContext(clientId, scope, redirectUri, codeChallenge, codeChallengeMethod, newResources);
    }
}
