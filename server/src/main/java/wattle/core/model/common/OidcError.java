package wattle.core.model.common;

/**
 * An OAuth 2.0 error response: the error code and a human readable description.
 *
 * @param error            error code, one of {@link ErrorCodes}
 * @param errorDescription description safe to return to the client
 */
public record OidcError(String error, String errorDescription) {

    public OidcError {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("Error code cannot be null or blank");
        }
    }

    public static OidcError invalidRequest(String description) {
        return new OidcError(ErrorCodes.INVALID_REQUEST, description);
    }

    public static OidcError invalidGrant(String description) {
        return new OidcError(ErrorCodes.INVALID_GRANT, description);
    }

    public static OidcError unauthorizedClient(String description) {
        return new OidcError(ErrorCodes.UNAUTHORIZED_CLIENT, description);
    }
}
