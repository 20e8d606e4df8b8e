package wattle.core.service.common;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TrustedProxyValidator")
class TrustedProxyValidatorTest {

    @Test
    @DisplayName("should trust no peer when no proxies are configured")
    void shouldTrustNothingByDefault() {
        var validator = new TrustedProxyValidator(List.of());

        assertFalse(validator.isTrustedProxy("10.0.0.1"));
        assertFalse(validator.isTrustedProxy("127.0.0.1"));
    }

    @Nested
    @DisplayName("Configured proxies")
    class ConfiguredProxies {

        private final TrustedProxyValidator validator =
                new TrustedProxyValidator(List.of("10.0.0.0/8", "192.168.1.10", " 2001:db8::/32 ", "172.16.0.0/12"));

        @Test
        @DisplayName("should match exact addresses")
        void shouldMatchExactAddress() {
            assertTrue(validator.isTrustedProxy("192.168.1.10"));
            assertFalse(validator.isTrustedProxy("192.168.1.11"));
        }

        @Test
        @DisplayName("should match IPv4 ranges on the prefix")
        void shouldMatchIpv4Ranges() {
            assertTrue(validator.isTrustedProxy("10.255.0.3"));
            assertTrue(validator.isTrustedProxy("172.31.255.255"));
            assertFalse(validator.isTrustedProxy("172.32.0.1"));
            assertFalse(validator.isTrustedProxy("203.0.113.9"));
        }

        @Test
        @DisplayName("should match IPv6 ranges")
        void shouldMatchIpv6Ranges() {
            assertTrue(validator.isTrustedProxy("2001:db8::1"));
            assertFalse(validator.isTrustedProxy("2001:db9::1"));
        }

        @Test
        @DisplayName("should reject hostnames and missing peers")
        void shouldRejectNonLiterals() {
            assertFalse(validator.isTrustedProxy("proxy.internal"));
            assertFalse(validator.isTrustedProxy(""));
            assertFalse(validator.isTrustedProxy(null));
        }
    }

    @Test
    @DisplayName("should ignore malformed entries")
    void shouldIgnoreMalformedEntries() {
        var validator = new TrustedProxyValidator(List.of("proxy.internal", "10.0.0.0/40", "10.0.0.0/x", "192.168.0.0/16"));

        assertFalse(validator.isTrustedProxy("10.0.0.1"));
        assertTrue(validator.isTrustedProxy("192.168.4.4"));
    }
}
