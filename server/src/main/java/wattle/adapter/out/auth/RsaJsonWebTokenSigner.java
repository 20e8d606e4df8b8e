package wattle.adapter.out.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.lang.JoseException;

import wattle.core.port.out.JsonWebTokenSigner;
import wattle.core.port.out.SigningKeyProvider;

/**
 * RS256 signer using the key from {@link SigningKeyProvider}.
 */
@ApplicationScoped
public class RsaJsonWebTokenSigner implements JsonWebTokenSigner {

    private final SigningKeyProvider keyProvider;

    @Inject
    public RsaJsonWebTokenSigner(SigningKeyProvider keyProvider) {
        this.keyProvider = keyProvider;
    }

    @Override
    public String sign(JwtClaims claims, String type) {
        final var key = keyProvider.currentSigningKey();
        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key.getPrivateKey());
        jws.setKeyIdHeaderValue(key.getKeyId());
        jws.setHeader("typ", type);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);

        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new TokenSigningException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    /**
     * Thrown when a token cannot be signed.
     */
    public static class TokenSigningException extends RuntimeException {
        public TokenSigningException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
