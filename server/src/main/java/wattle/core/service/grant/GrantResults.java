package wattle.core.service.grant;

import io.smallrye.mutiny.Uni;

import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizedGrant;

/**
 * Shorthands for grant handler outcomes.
 */
public final class GrantResults {

    private GrantResults() {}

    public static Result<AuthorizedGrant, OidcError> granted(AuthorizedGrant grant) {
        return Result.success(grant);
    }

    public static Result<AuthorizedGrant, OidcError> error(String error, String description) {
        return Result.failure(new OidcError(error, description));
    }

    public static Uni<Result<AuthorizedGrant, OidcError>> grantedUni(AuthorizedGrant grant) {
        return Uni.createFrom().item(granted(grant));
    }

    public static Uni<Result<AuthorizedGrant, OidcError>> errorUni(String error, String description) {
        return Uni.createFrom().item(error(error, description));
    }
}
