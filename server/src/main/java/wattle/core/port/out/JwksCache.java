package wattle.core.port.out;

import java.net.URI;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;

/**
 * Port for retrieving the key sets trusted issuers publish.
 */
public interface JwksCache {

    /**
     * Returns the key set published at a JWKS endpoint, from cache when fresh.
     *
     * @param jwksUri the JWKS endpoint
     */
    Uni<JsonWebKeySet> getKeySet(URI jwksUri);

    /**
     * Fetches a key set again, bypassing the cache, unless it was fetched within the minimum
     * refresh interval. In that case the current key set is returned.
     *
     * @param jwksUri the JWKS endpoint
     */
    Uni<JsonWebKeySet> refreshKeySet(URI jwksUri);

    /**
     * Returns the keys of a key set usable for signature verification: keys declaring
     * {@code use=sig} or no {@code use} at all.
     *
     * <p>When the cached key set has no key with the requested {@code kid}, the issuer may have
     * rotated its keys and the key set is refreshed once.
     *
     * @param jwksUri the JWKS endpoint
     * @param keyId   {@code kid} of the token to verify, may be null
     */
    default Uni<List<JsonWebKey>> getSigningKeys(URI jwksUri, String keyId) {
        return getKeySet(jwksUri).flatMap(keySet -> {
            if (keyId == null || keySet.getJsonWebKeys().stream().anyMatch(key -> keyId.equals(key.getKeyId()))) {
                return Uni.createFrom().item(signingKeys(keySet));
            }
            return refreshKeySet(jwksUri).map(JwksCache::signingKeys);
        });
    }

    private static List<JsonWebKey> signingKeys(JsonWebKeySet keySet) {
        return keySet.getJsonWebKeys().stream()
                .filter(key -> key.getUse() == null || "sig".equals(key.getUse()))
                .toList();
    }
}
