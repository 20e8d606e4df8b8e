package wattle.core.model.device;

/**
 * Progress of a device authorization request (RFC 8628).
 */
public enum DeviceAuthorizationStatus {
    PENDING,
    AUTHORIZED,
    DENIED
}
