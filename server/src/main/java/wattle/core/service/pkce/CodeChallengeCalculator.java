package wattle.core.service.pkce;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

import wattle.core.model.grant.CodeChallengeMethods;

/**
 * Computes PKCE code challenges from code verifiers (RFC 7636).
 */
@ApplicationScoped
public class CodeChallengeCalculator {

    /**
     * Computes the challenge for a verifier.
     *
     * <p>{@code plain} returns the verifier unchanged; {@code S256} and {@code S512}
     * return the base64url encoded (unpadded) SHA-256 or SHA-512 hash of the verifier's
     * ASCII bytes.
     *
     * @param method   the registered challenge method
     * @param verifier the code verifier sent with the token request
     * @throws IllegalArgumentException if the method is not supported
     */
    public String calculate(String method, String verifier) {
        if (CodeChallengeMethods.PLAIN.equals(method)) {
            return verifier;
        }
        if (CodeChallengeMethods.S256.equals(method)) {
            return hash("SHA-256", verifier);
        }
        if (CodeChallengeMethods.S512.equals(method)) {
            return hash("SHA-512", verifier);
        }
        throw new IllegalArgumentException("Unsupported code challenge method: " + method);
    }

    /**
     * Checks a verifier against a registered challenge. Comparison ignores case.
     */
    public boolean matches(String challenge, String method, String verifier) {
        return challenge.equalsIgnoreCase(calculate(method, verifier));
    }

    private String hash(String algorithm, String verifier) {
        try {
            final var digest = MessageDigest.getInstance(algorithm);
            final var hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " algorithm not available", e);
        }
    }
}
