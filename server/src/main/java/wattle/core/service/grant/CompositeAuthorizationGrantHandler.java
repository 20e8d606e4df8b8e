package wattle.core.service.grant;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.model.client.ClientInfo;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenRequest;
import wattle.core.port.in.AuthorizationGrantHandler;
import wattle.core.port.out.GrantMetrics;
import wattle.core.service.common.InvalidRequestException;

/**
 * Routes token requests to the handler registered for their grant type.
 *
 * <p>Grant types match case-insensitively. Handlers are discovered via CDI; two handlers
 * claiming the same grant type fail startup. A missing required parameter reported by a
 * handler becomes an {@code invalid_request} result.
 */
@ApplicationScoped
@Typed(CompositeAuthorizationGrantHandler.class)
public class CompositeAuthorizationGrantHandler implements AuthorizationGrantHandler {

    private static final Logger LOG = Logger.getLogger(CompositeAuthorizationGrantHandler.class);

    /**
     * Metric tag for requests naming no registered grant type. Client supplied values are
     * never used as tags.
     */
    static final String UNSUPPORTED_METRIC_TAG = "unsupported";

    private final Map<String, AuthorizationGrantHandler> handlers;
    private final Set<String> grantTypesSupported;
    private final GrantMetrics metrics;

    @Inject
    public CompositeAuthorizationGrantHandler(Instance<AuthorizationGrantHandler> handlers, GrantMetrics metrics) {
        this(handlers.stream().toList(), metrics);
    }

    public CompositeAuthorizationGrantHandler(List<AuthorizationGrantHandler> handlers, GrantMetrics metrics) {
        this.metrics = metrics;
        final var byGrantType = new HashMap<String, AuthorizationGrantHandler>();
        final var supported = new TreeSet<String>();
        for (var handler : handlers) {
            for (var grantType : handler.grantTypesSupported()) {
                final var existing = byGrantType.putIfAbsent(normalize(grantType), handler);
                if (existing != null) {
                    throw new IllegalStateException("Grant type " + grantType + " is handled by both "
                            + existing.getClass().getSimpleName() + " and "
                            + handler.getClass().getSimpleName());
                }
                supported.add(grantType);
            }
        }
        this.handlers = Map.copyOf(byGrantType);
        this.grantTypesSupported = Collections.unmodifiableSet(supported);
        LOG.infof("Registered grant types: %s", supported);
    }

    @Override
    public Set<String> grantTypesSupported() {
        return grantTypesSupported;
    }

    /**
     * Whether a handler is registered for the grant type.
     */
    public boolean supports(String grantType) {
        return grantType != null && handlers.containsKey(normalize(grantType));
    }

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> authorize(TokenRequest request, ClientInfo clientInfo) {
        final var grantType = request.grantType();
        final var handler = grantType != null ? handlers.get(normalize(grantType)) : null;
        if (handler == null) {
            LOG.debugf("Unsupported grant type %s requested by client %s", grantType, clientInfo.clientId());
            metrics.recordAuthorization(UNSUPPORTED_METRIC_TAG, ErrorCodes.UNSUPPORTED_GRANT_TYPE);
            return GrantResults.errorUni(
                    ErrorCodes.UNSUPPORTED_GRANT_TYPE, "The grant type " + grantType + " is not supported");
        }

        return Uni.createFrom()
                .deferred(() -> handler.authorize(request, clientInfo))
                .onFailure(InvalidRequestException.class)
                .recoverWithItem(error -> Result.failure(((InvalidRequestException) error).toOidcError()))
                .invoke(result -> metrics.recordAuthorization(normalize(grantType), outcome(result)));
    }

    private static String outcome(Result<AuthorizedGrant, OidcError> result) {
        return result.isSuccess() ? "success" : result.getFailure().error();
    }

    private static String normalize(String grantType) {
        return grantType.toLowerCase(Locale.ROOT);
    }
}
