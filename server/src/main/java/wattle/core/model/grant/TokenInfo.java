package wattle.core.model.grant;

import java.time.Instant;

/**
 * Identifier and expiry of a token issued from a grant.
 */
public record TokenInfo(String jwtId, Instant expiresAt) {}
