package wattle.core.port.out;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

/**
 * Port remembering the {@code jti} of consumed JWT assertions.
 */
public interface JwtReplayCache {

    /**
     * Checks whether a token id was already used.
     */
    Uni<Boolean> isReplayed(String jwtId);

    /**
     * Marks a token id as used until the token can no longer validate.
     *
     * @param jwtId     the {@code jti} claim
     * @param expiresAt the {@code exp} claim, null when the token carries none
     */
    Uni<Void> markAsUsed(String jwtId, Instant expiresAt);
}
