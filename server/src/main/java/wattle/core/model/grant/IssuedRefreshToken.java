package wattle.core.model.grant;

/**
 * A signed refresh token and the identifier it is tracked by.
 *
 * @param value compact JWS to hand to the client
 * @param info  {@code jti} and expiry of the token
 */
public record IssuedRefreshToken(String value, TokenInfo info) {}
