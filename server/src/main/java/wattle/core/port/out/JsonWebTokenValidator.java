package wattle.core.port.out;

import io.smallrye.mutiny.Uni;

import wattle.core.model.jwt.JwtValidationParameters;
import wattle.core.model.jwt.JwtValidationResult;

/**
 * Port for parsing and validating signed JWTs.
 */
public interface JsonWebTokenValidator {

    /**
     * Validates a compact serialized JWT.
     *
     * @param jwt        the token
     * @param parameters checks to perform and resolvers for issuer, audience and keys
     * @return the validated token or the reason it was rejected
     */
    Uni<JwtValidationResult> validate(String jwt, JwtValidationParameters parameters);
}
