package wattle.core.model.jwt;

/**
 * Checks a JWT validator performs beyond parsing and signature verification.
 */
public enum JwtValidationOption {
    VALIDATE_LIFETIME,
    VALIDATE_ISSUER,
    VALIDATE_AUDIENCE,
    REQUIRE_SIGNED_TOKENS
}
