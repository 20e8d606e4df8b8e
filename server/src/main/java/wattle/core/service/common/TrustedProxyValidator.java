package wattle.core.service.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import wattle.core.config.EndpointConfig;

/**
 * Decides whether a direct peer is a reverse proxy allowed to report the client address.
 *
 * <p>Entries of {@code wattle.oidc.endpoints.trusted-proxies} are IP literals or CIDR ranges,
 * parsed once at startup. Hostnames are never resolved.
 */
@ApplicationScoped
public class TrustedProxyValidator {

    private static final Logger LOG = Logger.getLogger(TrustedProxyValidator.class);

    private final List<Network> trustedNetworks;

    @Inject
    public TrustedProxyValidator(EndpointConfig config) {
        this(config.trustedProxies().orElse(List.of()));
    }

    public TrustedProxyValidator(List<String> trustedProxies) {
        this.trustedNetworks = trustedProxies.stream()
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .map(TrustedProxyValidator::parseNetwork)
                .filter(network -> network != null)
                .toList();
    }

    /**
     * Whether forwarding headers sent by the peer may be trusted.
     *
     * @param peerAddress IP address of the direct connection
     */
    public boolean isTrustedProxy(String peerAddress) {
        if (trustedNetworks.isEmpty()) {
            return false;
        }
        final var address = parseLiteral(peerAddress);
        if (address == null) {
            return false;
        }
        return trustedNetworks.stream().anyMatch(network -> network.contains(address));
    }

    private static Network parseNetwork(String entry) {
        final var slash = entry.indexOf('/');
        final var address = parseLiteral(slash < 0 ? entry : entry.substring(0, slash));
        if (address == null) {
            LOG.warnf("Ignoring trusted proxy entry that is not an IP address or CIDR range: %s", entry);
            return null;
        }
        if (slash < 0) {
            return new Network(address, address.length * 8);
        }
        try {
            final var prefixLength = Integer.parseInt(entry.substring(slash + 1));
            if (prefixLength < 0 || prefixLength > address.length * 8) {
                LOG.warnf("Ignoring trusted proxy range with invalid prefix length: %s", entry);
                return null;
            }
            return new Network(address, prefixLength);
        } catch (NumberFormatException e) {
            LOG.warnf("Ignoring trusted proxy range with invalid prefix length: %s", entry);
            return null;
        }
    }

    /**
     * Parses an IPv4 or IPv6 literal, or returns null for anything else.
     */
    private static byte[] parseLiteral(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        final var ipv6 = value.indexOf(':') >= 0;
        if (!ipv6 && !value.chars().allMatch(c -> c == '.' || Character.isDigit(c))) {
            return null;
        }
        try {
            // literal input only, so no DNS lookup happens
            return InetAddress.getByName(value).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private record Network(byte[] address, int prefixLength) {

        boolean contains(byte[] candidate) {
            if (candidate.length != address.length) {
                return false;
            }
            final var fullBytes = prefixLength / 8;
            if (!Arrays.equals(address, 0, fullBytes, candidate, 0, fullBytes)) {
                return false;
            }
            final var remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            final var mask = (byte) (0xFF << (8 - remainingBits));
            return (address[fullBytes] & mask) == (candidate[fullBytes] & mask);
        }
    }
}
