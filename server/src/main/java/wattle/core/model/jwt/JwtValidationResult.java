package wattle.core.model.jwt;

/**
 * Outcome of validating a JWT.
 */
public sealed interface JwtValidationResult {

    /**
     * The token passed every requested check.
     */
    record Valid(JsonWebToken token) implements JwtValidationResult {}

    /**
     * The token failed a check.
     *
     * @param error       which check failed
     * @param description human readable reason, for logs
     * @param token       the unverified header and claims, or null when the token could not be parsed
     */
    record Invalid(JwtError error, String description, JsonWebToken token) implements JwtValidationResult {}

    static JwtValidationResult invalid(JwtError error, String description) {
        return new Invalid(error, description, null);
    }

    static JwtValidationResult invalid(JwtError error, String description, JsonWebToken token) {
        return new Invalid(error, description, token);
    }
}
