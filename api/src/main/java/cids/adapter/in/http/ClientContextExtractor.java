package cids.adapter.in.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.HttpHeaders;

import io.vertx.core.http.HttpServerRequest;

import cids.core.model.token.ClientContext;

/**
 * Derives the caller IP and device fingerprint used for token binding.
 *
 * <p>When the direct peer is a trusted proxy, the IP is taken from its headers in
 * priority order:
 * <ol>
 *   <li>X-Forwarded-For (first IP in chain)</li>
 *   <li>RFC 7239 Forwarded header</li>
 *   <li>X-Real-IP</li>
 *   <li>Socket remote address (fallback)</li>
 * </ol>
 */
@ApplicationScoped
public class ClientContextExtractor {

    static final String DEVICE_HEADER = "X-Device-Fingerprint";

    private final TrustedProxyValidator trustedProxies;

    @Inject
    public ClientContextExtractor(TrustedProxyValidator trustedProxies) {
        this.trustedProxies = trustedProxies;
    }

    public ClientContext extract(HttpHeaders headers, HttpServerRequest request) {
        final var socketIp = request != null && request.remoteAddress() != null
                ? request.remoteAddress().hostAddress()
                : null;
        var ip = trustedProxies.isTrusted(socketIp) ? ipFromHeaders(headers) : null;
        if (ip == null || ip.isEmpty()) {
            ip = socketIp;
        }
        final var device = headers.getHeaderString(DEVICE_HEADER);
        return new ClientContext(ip, device == null || device.isBlank() ? null : device.trim());
    }

    private static String ipFromHeaders(HttpHeaders headers) {
        final var xForwardedFor = headers.getHeaderString("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        final var forwarded = headers.getHeaderString("Forwarded");
        if (forwarded != null && !forwarded.isEmpty()) {
            final var forParam = forwardedFor(forwarded);
            if (forParam != null) {
                return forParam;
            }
        }
        final var xRealIp = headers.getHeaderString("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp.trim();
        }
        return null;
    }

    static String forwardedFor(String forwarded) {
        final var first = forwarded.split(",")[0];
        for (var part : first.split(";")) {
            final var kv = part.trim().split("=", 2);
            if (kv.length == 2 && "for".equalsIgnoreCase(kv[0].trim())) {
                var value = kv[1].trim();
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() > 1) {
                    value = value.substring(1, value.length() - 1);
                }
                if (value.startsWith("[")) {
                    final var end = value.indexOf(']');
                    return end > 0 ? value.substring(1, end) : value;
                }
                final var colon = value.indexOf(':');
                return colon > 0 && value.indexOf(':', colon + 1) < 0 ? value.substring(0, colon) : value;
            }
        }
        return null;
    }
}
