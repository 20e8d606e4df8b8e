package wattle.core.port.out;

import java.util.List;

import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.RsaJsonWebKey;

/**
 * Port exposing the server's own signing keys.
 */
public interface SigningKeyProvider {

    /**
     * The key new tokens are signed with, including its private part.
     */
    RsaJsonWebKey currentSigningKey();

    /**
     * Public keys tokens issued by this server may be verified with.
     */
    List<JsonWebKey> verificationKeys();
}
