package wattle.adapter.out.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwt.consumer.JwtContext;
import org.jose4j.jwx.JsonWebStructure;

import wattle.core.model.jwt.JsonWebToken;
import wattle.core.model.jwt.JwtError;
import wattle.core.model.jwt.JwtValidationOption;
import wattle.core.model.jwt.JwtValidationParameters;
import wattle.core.model.jwt.JwtValidationResult;
import wattle.core.port.out.JsonWebTokenValidator;

/**
 * JWT validator built on jose4j.
 *
 * <p>The token is parsed once without verification to read its header and claims, then
 * issuer and audience go through the caller's callbacks, and finally the signature and
 * time based claims are verified against each candidate key until one verifies.
 * Candidate keys are those resolved for the issuer, narrowed to the token's {@code kid}
 * when it has one.
 */
@ApplicationScoped
public class Jose4jJsonWebTokenValidator implements JsonWebTokenValidator {

    private static final Logger LOG = Logger.getLogger(Jose4jJsonWebTokenValidator.class);

    private final Clock clock;

    @Inject
    public Jose4jJsonWebTokenValidator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<JwtValidationResult> validate(String jwt, JwtValidationParameters parameters) {
        if (jwt == null || jwt.isBlank()) {
            return Uni.createFrom().item(JwtValidationResult.invalid(JwtError.INVALID_TOKEN, "Token is empty"));
        }

        final ParsedToken parsed;
        try {
            parsed = parse(jwt);
        } catch (InvalidJwtException | MalformedClaimException e) {
            LOG.debugv("JWT parsing failed: {0}", e.getMessage());
            return Uni.createFrom().item(JwtValidationResult.invalid(JwtError.INVALID_TOKEN, "Malformed token"));
        }

        final var token = parsed.token();
        if (parameters.has(JwtValidationOption.REQUIRE_SIGNED_TOKENS)
                && (token.algorithm() == null || "none".equals(token.algorithm()))) {
            return Uni.createFrom()
                    .item(JwtValidationResult.invalid(JwtError.INVALID_SIGNATURE, "Token is not signed", token));
        }

        return checkIssuer(token, parameters)
                .flatMap(issuerError -> {
                    if (issuerError != null) {
                        return Uni.createFrom().item(issuerError);
                    }
                    return checkAudience(token, parameters);
                })
                .flatMap(claimError -> {
                    if (claimError != null) {
                        return Uni.createFrom().item(claimError);
                    }
                    return parameters
                            .signingKeyResolver()
                            .apply(token)
                            .map(keys -> verify(jwt, token, candidateKeys(keys, token.keyId()), parameters));
                });
    }

    private Uni<JwtValidationResult> checkIssuer(JsonWebToken token, JwtValidationParameters parameters) {
        if (!parameters.has(JwtValidationOption.VALIDATE_ISSUER)) {
            return Uni.createFrom().nullItem();
        }
        if (token.issuer() == null || parameters.issuerValidator() == null) {
            return Uni.createFrom()
                    .item(JwtValidationResult.invalid(JwtError.INVALID_ISSUER, "Issuer is missing", token));
        }
        return parameters.issuerValidator().apply(token.issuer()).map(valid -> valid
                ? null
                : JwtValidationResult.invalid(
                        JwtError.INVALID_ISSUER, "Issuer " + token.issuer() + " is not valid", token));
    }

    private Uni<JwtValidationResult> checkAudience(JsonWebToken token, JwtValidationParameters parameters) {
        if (!parameters.has(JwtValidationOption.VALIDATE_AUDIENCE)) {
            return Uni.createFrom().nullItem();
        }
        if (token.audiences().isEmpty() || parameters.audienceValidator() == null) {
            return Uni.createFrom()
                    .item(JwtValidationResult.invalid(JwtError.INVALID_AUDIENCE, "Audience is missing", token));
        }
        return parameters.audienceValidator().apply(token.audiences()).map(valid -> valid
                ? null
                : JwtValidationResult.invalid(JwtError.INVALID_AUDIENCE, "Audience is not valid", token));
    }

    private static List<JsonWebKey> candidateKeys(List<JsonWebKey> keys, String keyId) {
        if (keyId == null) {
            return keys;
        }
        return keys.stream().filter(key -> keyId.equals(key.getKeyId())).toList();
    }

    private JwtValidationResult verify(
            String jwt, JsonWebToken token, List<JsonWebKey> keys, JwtValidationParameters parameters) {
        if (keys.isEmpty()) {
            return JwtValidationResult.invalid(JwtError.INVALID_SIGNATURE, "No signing key found for the token", token);
        }

        for (var key : keys) {
            final var builder = new JwtConsumerBuilder()
                    .setVerificationKey(key.getKey())
                    .setSkipDefaultAudienceValidation();

            if (parameters.has(JwtValidationOption.VALIDATE_LIFETIME)) {
                builder.setRequireExpirationTime()
                        .setAllowedClockSkewInSeconds((int) parameters.clockSkew().toSeconds())
                        .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()));
            } else {
                builder.setSkipAllDefaultValidators();
            }

            try {
                builder.build().process(jwt);
                return new JwtValidationResult.Valid(token);
            } catch (InvalidJwtException e) {
                if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
                    LOG.debugv("Signature did not verify with key {0}", key.getKeyId());
                    continue;
                }
                return summarizeJwtError(e, token);
            }
        }

        return JwtValidationResult.invalid(JwtError.INVALID_SIGNATURE, "Token signature is not valid", token);
    }

    private static JwtValidationResult summarizeJwtError(InvalidJwtException e, JsonWebToken token) {
        if (e.hasExpired()) {
            return JwtValidationResult.invalid(JwtError.TOKEN_EXPIRED, "Token has expired", token);
        }
        if (e.hasErrorCode(ErrorCodes.NOT_BEFORE_MISSING) || e.hasErrorCode(ErrorCodes.NOT_YET_VALID)) {
            return JwtValidationResult.invalid(JwtError.TOKEN_EXPIRED, "Token is not yet valid", token);
        }
        if (e.hasErrorCode(ErrorCodes.EXPIRATION_MISSING)) {
            return JwtValidationResult.invalid(JwtError.INVALID_TOKEN, "Token has no expiration time", token);
        }
        LOG.debugv("JWT validation failed: {0}", e.getMessage());
        return JwtValidationResult.invalid(JwtError.INVALID_TOKEN, "Token validation failed", token);
    }

    private static ParsedToken parse(String jwt) throws InvalidJwtException, MalformedClaimException {
        final JwtContext context = new JwtConsumerBuilder()
                .setSkipAllValidators()
                .setDisableRequireSignature()
                .setSkipSignatureVerification()
                .build()
                .process(jwt);

        final JsonWebStructure header = context.getJoseObjects().get(0);
        final JwtClaims claims = context.getJwtClaims();

        final var token = new JsonWebToken(
                header.getAlgorithmHeaderValue(),
                header.getHeader("typ"),
                header.getKeyIdHeaderValue(),
                claims.getSubject(),
                claims.getIssuer(),
                claims.hasAudience() ? claims.getAudience() : List.of(),
                claims.getJwtId(),
                toInstant(claims.getIssuedAt()),
                toInstant(claims.getExpirationTime()),
                claims.getClaimsMap());
        return new ParsedToken(token);
    }

    private static Instant toInstant(NumericDate date) {
        return date != null ? Instant.ofEpochMilli(date.getValueInMillis()) : null;
    }

    private record ParsedToken(JsonWebToken token) {}
}
