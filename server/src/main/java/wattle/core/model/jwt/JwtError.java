package wattle.core.model.jwt;

/**
 * Classification of JWT validation failures.
 */
public enum JwtError {
    INVALID_TOKEN,
    INVALID_ISSUER,
    INVALID_AUDIENCE,
    INVALID_SIGNATURE,
    TOKEN_EXPIRED
}
