package wattle.core.service.common;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generates unguessable identifiers for codes, request ids and sessions.
 */
@ApplicationScoped
public class RandomValueGenerator {

    private static final int SESSION_ID_BYTES = 16;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Returns {@code byteLength} random bytes encoded as base64url without padding.
     */
    public String randomUrlSafe(int byteLength) {
        final var bytes = new byte[byteLength];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public String newSessionId() {
        return randomUrlSafe(SESSION_ID_BYTES);
    }
}
