package wattle.core.port.out;

import java.net.URI;

/**
 * Port describing the HTTP request currently being processed.
 */
public interface RequestInfoProvider {

    /** Absolute URI of the current request. */
    URI requestUri();

    /** Public base URI of the application. */
    URI applicationUri();

    /** Caller IP address, or null when unknown. */
    String remoteIpAddress();
}
