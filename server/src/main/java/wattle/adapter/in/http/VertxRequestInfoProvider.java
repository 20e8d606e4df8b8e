package wattle.adapter.in.http;

import java.net.URI;

import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;

import io.quarkus.vertx.http.runtime.CurrentVertxRequest;

import wattle.core.config.EndpointConfig;
import wattle.core.port.out.RequestInfoProvider;
import wattle.core.service.common.TrustedProxyValidator;

/**
 * Request metadata read from the Vert.x request being served.
 *
 * <p>{@code X-Forwarded-For} is only honoured when the direct peer is a trusted proxy.
 */
@RequestScoped
public class VertxRequestInfoProvider implements RequestInfoProvider {

    private final CurrentVertxRequest currentRequest;
    private final EndpointConfig config;
    private final TrustedProxyValidator trustedProxyValidator;

    @Inject
    public VertxRequestInfoProvider(
            CurrentVertxRequest currentRequest, EndpointConfig config, TrustedProxyValidator trustedProxyValidator) {
        this.currentRequest = currentRequest;
        this.config = config;
        this.trustedProxyValidator = trustedProxyValidator;
    }

    @Override
    public URI requestUri() {
        final var context = currentRequest.getCurrent();
        if (context == null) {
            return null;
        }
        return URI.create(context.request().absoluteURI());
    }

    @Override
    public URI applicationUri() {
        return config.applicationUri();
    }

    @Override
    public String remoteIpAddress() {
        final var context = currentRequest.getCurrent();
        if (context == null) {
            return null;
        }
        final var remote = context.request().remoteAddress();
        final var peer = remote != null ? remote.host() : null;
        if (!trustedProxyValidator.isTrustedProxy(peer)) {
            return peer;
        }
        final var forwarded = context.request().getHeader("X-Forwarded-For");
        if (forwarded == null || forwarded.isBlank()) {
            return peer;
        }
        final var client = forwarded.split(",")[0].trim();
        return client.isEmpty() ? peer : client;
    }
}
