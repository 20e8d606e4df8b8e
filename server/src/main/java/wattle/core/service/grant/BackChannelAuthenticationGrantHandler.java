package wattle.core.service.grant;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.config.BackChannelAuthenticationConfig;
import wattle.core.model.backchannel.BackChannelAuthenticationRequest;
import wattle.core.model.client.BackChannelTokenDeliveryMode;
import wattle.core.model.client.ClientInfo;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.GrantTypes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenRequest;
import wattle.core.port.in.AuthorizationGrantHandler;
import wattle.core.port.out.BackChannelStatusNotifier;
import wattle.core.port.out.GrantMetrics;
import wattle.core.service.backchannel.BackChannelAuthenticationStorage;
import wattle.core.service.backchannel.BackChannelGrantProcessor;
import wattle.core.service.common.ParameterValidator;

/**
 * Token requests for client-initiated backchannel authentication (OpenID Connect CIBA).
 *
 * <p>A request moves from {@code PENDING} to {@code AUTHENTICATED} or {@code DENIED};
 * an absent request has expired or was consumed. Every path checks that the requesting
 * client owns the request before looking at its status.
 *
 * <p>Clients polling faster than the configured interval get {@code slow_down}. With long
 * polling enabled, a pending token request waits for a status change notification up to
 * the configured timeout, then re-reads the request once.
 *
 * <p>Concurrent polls of one request may both pass the {@code nextPollAt} check before
 * either stores its update. The only effect is a poll slipping through one interval
 * early, so the race is left unguarded.
 */
@ApplicationScoped
public class BackChannelAuthenticationGrantHandler implements AuthorizationGrantHandler {

    private static final Logger LOG = Logger.getLogger(BackChannelAuthenticationGrantHandler.class);

    private final BackChannelAuthenticationStorage storage;
    private final BackChannelStatusNotifier notifier;
    private final Map<BackChannelTokenDeliveryMode, BackChannelGrantProcessor> processors;
    private final BackChannelAuthenticationConfig config;
    private final Clock clock;
    private final GrantMetrics metrics;

    @Inject
    public BackChannelAuthenticationGrantHandler(
            BackChannelAuthenticationStorage storage,
            BackChannelStatusNotifier notifier,
            Instance<BackChannelGrantProcessor> processors,
            BackChannelAuthenticationConfig config,
            Clock clock,
            GrantMetrics metrics) {
        this(storage, notifier, processors.stream().toList(), config, clock, metrics);
    }

    public BackChannelAuthenticationGrantHandler(
            BackChannelAuthenticationStorage storage,
            BackChannelStatusNotifier notifier,
            List<BackChannelGrantProcessor> processors,
            BackChannelAuthenticationConfig config,
            Clock clock,
            GrantMetrics metrics) {
        this.storage = storage;
        this.notifier = notifier;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
        this.processors = new EnumMap<>(BackChannelTokenDeliveryMode.class);
        for (var processor : processors) {
            for (var mode : processor.deliveryModes()) {
                if (this.processors.putIfAbsent(mode, processor) != null) {
                    throw new IllegalStateException("Duplicate processor for token delivery mode " + mode);
                }
            }
        }
    }

    @Override
    public Set<String> grantTypesSupported() {
        return Set.of(GrantTypes.CIBA);
    }

    @Override
    public Uni<Result<AuthorizedGrant, OidcError>> authorize(TokenRequest request, ClientInfo clientInfo) {
        final var requestId = ParameterValidator.required(request.authenticationRequestId(), "auth_req_id");
        return storage.tryGet(requestId).flatMap(found -> evaluate(requestId, found, clientInfo, true));
    }

    private Uni<Result<AuthorizedGrant, OidcError>> evaluate(
            String requestId,
            Optional<BackChannelAuthenticationRequest> found,
            ClientInfo clientInfo,
            boolean mayWait) {
        if (found.isEmpty()) {
            LOG.debugf("Authentication request %s not found or expired", requestId);
            return GrantResults.errorUni(ErrorCodes.EXPIRED_TOKEN, "The authentication request has expired");
        }

        final var authenticationRequest = found.get();
        if (!authenticationRequest.clientId().equals(clientInfo.clientId())) {
            LOG.warnv(
                    "Client {0} presented authentication request {1} issued to another client",
                    clientInfo.clientId(),
                    requestId);
            return GrantResults.errorUni(
                    ErrorCodes.UNAUTHORIZED_CLIENT, "The authentication request was issued to another client");
        }

        return switch (authenticationRequest.status()) {
            case AUTHENTICATED -> processorFor(clientInfo).process(requestId, authenticationRequest);
            case DENIED -> storage.tryRemove(requestId)
                    .replaceWith(GrantResults.error(
                            ErrorCodes.ACCESS_DENIED, "The user denied the authentication request"));
            case PENDING -> mayWait
                    ? pending(requestId, authenticationRequest, clientInfo)
                    : GrantResults.errorUni(
                            ErrorCodes.AUTHORIZATION_PENDING, "The authentication request is pending");
            default -> throw new IllegalStateException(
                    "Unexpected authentication request status: " + authenticationRequest.status());
        };
    }

    private Uni<Result<AuthorizedGrant, OidcError>> pending(
            String requestId, BackChannelAuthenticationRequest authenticationRequest, ClientInfo clientInfo) {
        final var now = clock.instant();
        if (authenticationRequest.nextPollAt() != null && now.isBefore(authenticationRequest.nextPollAt())) {
            LOG.debugf("Client %s polls request %s too frequently", clientInfo.clientId(), requestId);
            return GrantResults.errorUni(ErrorCodes.SLOW_DOWN, "The client polls too frequently");
        }

        final var remaining = Duration.between(now, authenticationRequest.expiresAt());
        if (remaining.isNegative() || remaining.isZero()) {
            return GrantResults.errorUni(ErrorCodes.EXPIRED_TOKEN, "The authentication request has expired");
        }

        final var updated = authenticationRequest.withNextPollAt(now.plus(config.pollingInterval()));
        return storage.update(requestId, updated, remaining).flatMap(v -> {
            if (!config.useLongPolling()) {
                return GrantResults.errorUni(
                        ErrorCodes.AUTHORIZATION_PENDING, "The authentication request is pending");
            }
            return waitForStatusChange(requestId, clientInfo);
        });
    }

    private Uni<Result<AuthorizedGrant, OidcError>> waitForStatusChange(String requestId, ClientInfo clientInfo) {
        final var startedAt = clock.millis();
        return notifier.waitForStatusChange(requestId, config.longPollingTimeout())
                .flatMap(notified -> {
                    metrics.recordLongPoll(notified, clock.millis() - startedAt);
                    if (!notified) {
                        return GrantResults.errorUni(
                                ErrorCodes.AUTHORIZATION_PENDING, "The authentication request is pending");
                    }
                    LOG.debugf("Authentication request %s changed while long polling", requestId);
                    return storage.tryGet(requestId).flatMap(found -> evaluate(requestId, found, clientInfo, false));
                });
    }

    private BackChannelGrantProcessor processorFor(ClientInfo clientInfo) {
        final var mode = clientInfo.backChannelTokenDeliveryMode() != null
                ? clientInfo.backChannelTokenDeliveryMode()
                : BackChannelTokenDeliveryMode.PING;
        final var processor = processors.get(mode);
        if (processor == null) {
            throw new IllegalStateException("No processor for token delivery mode " + mode);
        }
        return processor;
    }
}
