package wattle.core.model.grant;

import java.util.ArrayList;
import java.util.List;

/**
 * Successful authorization: the session and context tokens will be issued for.
 *
 * @param authSession  the authenticated session
 * @param context      the authorization context
 * @param issuedTokens tokens already issued from this grant (authorization codes only)
 */
public record AuthorizedGrant(AuthSession authSession, AuthorizationContext context, List<TokenInfo> issuedTokens) {

    public AuthorizedGrant {
        if (authSession == null) {
            throw new IllegalArgumentException("Auth session cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("Authorization context cannot be null");
        }
        issuedTokens = issuedTokens != null ? List.copyOf(issuedTokens) : List.of();
    }

    public AuthorizedGrant(AuthSession authSession, AuthorizationContext context) {
        this(authSession, context, List.of());
    }

    public AuthorizedGrant withIssuedTokens(List<TokenInfo> tokens) {
        final var all = new ArrayList<>(issuedTokens);
        all.addAll(tokens);
        return new AuthorizedGrant(authSession, context, all);
    }
}
