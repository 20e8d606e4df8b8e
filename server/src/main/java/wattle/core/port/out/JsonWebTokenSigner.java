package wattle.core.port.out;

import org.jose4j.jwt.JwtClaims;

/**
 * Port signing tokens with the server's current key.
 */
public interface JsonWebTokenSigner {

    /**
     * Signs claims as a compact JWS.
     *
     * @param claims the payload
     * @param type   the {@code typ} header
     * @return the compact serialization
     */
    String sign(JwtClaims claims, String type);
}
