package cids.adapter.in.http;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import cids.core.config.TrustedProxyConfig;

/**
 * Decides whether the direct peer of a request is a trusted proxy, so that its
 * forwarding headers may name the real caller.
 *
 * <p>Fails closed: with no configured proxies nobody is trusted. Parsed CIDR
 * networks are cached.
 */
@ApplicationScoped
public class TrustedProxyValidator {

    private static final Logger LOG = Logger.getLogger(TrustedProxyValidator.class);

    private static final ParsedCidr INVALID_CIDR = new ParsedCidr(new byte[0], -1);
    private static final byte[] INVALID_IP = new byte[0];

    private final List<String> proxies;
    private final Map<String, ParsedCidr> cidrCache = new ConcurrentHashMap<>();
    private final Map<String, byte[]> proxyIpCache = new ConcurrentHashMap<>();

    private record ParsedCidr(byte[] networkBytes, int prefixLength) {}

    @Inject
    public TrustedProxyValidator(TrustedProxyConfig config) {
        this(config.trustedProxies().orElse(List.of()));
    }

    TrustedProxyValidator(List<String> proxies) {
        this.proxies = List.copyOf(proxies);
        if (!this.proxies.isEmpty()) {
            LOG.infov("Forwarding headers trusted from {0}", this.proxies);
        }
    }

    /**
     * @param socketIp remote address of the direct connection
     * @return true if forwarding headers sent by this peer may be used
     */
    public boolean isTrusted(String socketIp) {
        if (proxies.isEmpty() || socketIp == null || socketIp.isEmpty()) {
            return false;
        }
        final var sourceBytes = parseIpAddress(socketIp);
        if (sourceBytes == null) {
            return false;
        }
        for (var pattern : proxies) {
            if (pattern.contains("/") ? matchesCidr(sourceBytes, pattern) : matchesExact(sourceBytes, pattern)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesExact(byte[] sourceBytes, String pattern) {
        final var patternBytes = proxyIpCache.computeIfAbsent(pattern.trim(), TrustedProxyValidator::parseLiteral);
        return patternBytes != INVALID_IP && Arrays.equals(sourceBytes, patternBytes);
    }

    private boolean matchesCidr(byte[] sourceBytes, String cidr) {
        final var parsed = cidrCache.computeIfAbsent(cidr.trim(), TrustedProxyValidator::parseCidr);
        if (parsed == INVALID_CIDR || parsed.networkBytes().length != sourceBytes.length) {
            return false;
        }
        final var network = parsed.networkBytes();
        final var fullBytes = parsed.prefixLength() / 8;
        final var remainingBits = parsed.prefixLength() % 8;
        for (var i = 0; i < fullBytes; i++) {
            if (network[i] != sourceBytes[i]) {
                return false;
            }
        }
        if (remainingBits > 0) {
            final var mask = (byte) (0xFF << (8 - remainingBits));
            return (network[fullBytes] & mask) == (sourceBytes[fullBytes] & mask);
        }
        return true;
    }

    private static ParsedCidr parseCidr(String cidr) {
        final var parts = cidr.split("/");
        if (parts.length != 2) {
            LOG.warnv("Ignoring trusted proxy {0}: expected ip/prefix", cidr);
            return INVALID_CIDR;
        }
        final var address = parseLiteral(parts[0]);
        if (address == INVALID_IP) {
            LOG.warnv("Ignoring trusted proxy {0}: invalid network address", cidr);
            return INVALID_CIDR;
        }
        try {
            final var prefixLength = Integer.parseInt(parts[1]);
            if (prefixLength < 0 || prefixLength > address.length * 8) {
                LOG.warnv("Ignoring trusted proxy {0}: prefix out of range", cidr);
                return INVALID_CIDR;
            }
            return new ParsedCidr(address, prefixLength);
        } catch (NumberFormatException e) {
            LOG.warnv("Ignoring trusted proxy {0}: invalid prefix", cidr);
            return INVALID_CIDR;
        }
    }

    private static byte[] parseIpAddress(String ip) {
        final var bytes = parseLiteral(ip);
        return bytes == INVALID_IP ? null : bytes;
    }

    /**
     * Never resolves hostnames: only IP literals reach {@link InetAddress#getByName}.
     */
    private static byte[] parseLiteral(String ip) {
        if (!isIpLiteral(ip)) {
            return INVALID_IP;
        }
        try {
            return InetAddress.getByName(ip).getAddress();
        } catch (UnknownHostException e) {
            return INVALID_IP;
        }
    }

    private static boolean isIpLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }
        if (input.contains(":")) {
            return true;
        }
        if (!Character.isDigit(input.charAt(0))) {
            return false;
        }
        for (var i = 0; i < input.length(); i++) {
            final var c = input.charAt(i);
            if (c != '.' && !Character.isDigit(c)) {
                return false;
            }
        }
        return true;
    }
}
