package wattle.core.model.grant;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * An authenticated user session on whose behalf tokens are issued.
 *
 * @param subject               subject identifier of the resource owner
 * @param sessionId             session identifier
 * @param authenticationTime    when the user authenticated
 * @param identityProvider      who authenticated the user
 * @param affectedClientIds     clients that received tokens within this session
 * @param authContextClassRef   authentication context class reference, if any
 * @param authenticationMethods authentication method references
 */
public record AuthSession(
        String subject,
        String sessionId,
        Instant authenticationTime,
        String identityProvider,
        Set<String> affectedClientIds,
        String authContextClassRef,
        List<String> authenticationMethods) {

    public AuthSession {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
        if (authenticationTime == null) {
            throw new IllegalArgumentException("Authentication time cannot be null");
        }
        affectedClientIds = affectedClientIds != null ? Set.copyOf(affectedClientIds) : Set.of();
        authenticationMethods = authenticationMethods != null ? List.copyOf(authenticationMethods) : List.of();
    }

    public static AuthSession of(
            String subject, String sessionId, Instant authenticationTime, String identityProvider, String clientId) {
        return new AuthSession(
                subject, sessionId, authenticationTime, identityProvider, Set.of(clientId), null, List.of());
    }
}
