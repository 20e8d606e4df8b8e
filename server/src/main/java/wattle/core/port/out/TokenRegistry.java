package wattle.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import wattle.core.model.jwt.TokenStatus;

/**
 * Port tracking the status of issued tokens by {@code jti}.
 */
public interface TokenRegistry {

    Uni<Optional<TokenStatus>> getStatus(String jwtId);

    /**
     * Records a token status until the token expires.
     */
    Uni<Void> setStatus(String jwtId, TokenStatus status, Instant expiresAt);
}
