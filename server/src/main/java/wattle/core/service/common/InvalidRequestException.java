package wattle.core.service.common;

import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.OidcError;

/**
 * Thrown when a token request lacks a parameter its grant type requires.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public OidcError toOidcError() {
        return new OidcError(ErrorCodes.INVALID_REQUEST, getMessage());
    }
}
