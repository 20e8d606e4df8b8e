package wattle.core.model.jwt;

/**
 * Lifecycle status of an issued token tracked in the token registry.
 */
public enum TokenStatus {
    ACTIVE,
    USED,
    REVOKED
}
