package wattle.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import io.quarkus.vertx.http.runtime.CurrentVertxRequest;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import wattle.core.config.EndpointConfig;
import wattle.core.service.common.TrustedProxyValidator;

@DisplayName("VertxRequestInfoProvider")
class VertxRequestInfoProviderTest {

    private CurrentVertxRequest currentRequest;
    private HttpServerRequest request;
    private VertxRequestInfoProvider provider;

    @BeforeEach
    void setUp() {
        currentRequest = mock(CurrentVertxRequest.class);
        request = mock(HttpServerRequest.class);
        var context = mock(RoutingContext.class);
        when(currentRequest.getCurrent()).thenReturn(context);
        when(context.request()).thenReturn(request);
        provider = new VertxRequestInfoProvider(
                currentRequest, mock(EndpointConfig.class), new TrustedProxyValidator(List.of("10.0.0.0/8")));
    }

    private void peer(String host, String forwardedFor) {
        var address = mock(SocketAddress.class);
        when(address.host()).thenReturn(host);
        when(request.remoteAddress()).thenReturn(address);
        when(request.getHeader("X-Forwarded-For")).thenReturn(forwardedFor);
    }

    @Test
    @DisplayName("should ignore X-Forwarded-For from an untrusted peer")
    void shouldIgnoreForwardedForFromUntrustedPeer() {
        peer("203.0.113.9", "10.0.0.1");

        assertEquals("203.0.113.9", provider.remoteIpAddress());
    }

    @Test
    @DisplayName("should use the first X-Forwarded-For entry from a trusted proxy")
    void shouldHonourForwardedForFromTrustedProxy() {
        peer("10.1.2.3", "198.51.100.7, 10.1.2.3");

        assertEquals("198.51.100.7", provider.remoteIpAddress());
    }

    @Test
    @DisplayName("should fall back to the peer when a trusted proxy sends no header")
    void shouldFallBackToPeer() {
        peer("10.1.2.3", null);

        assertEquals("10.1.2.3", provider.remoteIpAddress());
    }

    @Test
    @DisplayName("should report nothing outside a request")
    void shouldReportNothingOutsideRequest() {
        when(currentRequest.getCurrent()).thenReturn(null);

        assertNull(provider.remoteIpAddress());
    }
}
