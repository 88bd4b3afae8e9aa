package cids.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import jakarta.ws.rs.core.HttpHeaders;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ClientContextExtractor")
class ClientContextExtractorTest {

    private static final String PROXY = "10.9.9.9";

    private HttpHeaders headers;
    private HttpServerRequest request;

    private static ClientContextExtractor behindProxy() {
        return new ClientContextExtractor(new TrustedProxyValidator(List.of("10.9.0.0/16")));
    }

    private static ClientContextExtractor direct() {
        return new ClientContextExtractor(new TrustedProxyValidator(List.of()));
    }

    @BeforeEach
    void setUp() {
        headers = mock(HttpHeaders.class);
        request = mock(HttpServerRequest.class);
        final var address = mock(SocketAddress.class);
        when(address.hostAddress()).thenReturn(PROXY);
        when(request.remoteAddress()).thenReturn(address);
    }

    @Nested
    @DisplayName("extract()")
    class Extract {

        @Test
        @DisplayName("should take the first X-Forwarded-For address")
        void shouldUseForwardedForChain() {
            when(headers.getHeaderString("X-Forwarded-For")).thenReturn("203.0.113.7, 10.0.0.1");

            final var context = behindProxy().extract(headers, request);

            assertEquals("203.0.113.7", context.ipAddress());
        }

        @Test
        @DisplayName("should fall back to X-Real-IP")
        void shouldUseRealIp() {
            when(headers.getHeaderString("X-Real-IP")).thenReturn(" 198.51.100.2 ");

            assertEquals(
                    "198.51.100.2",
                    behindProxy().extract(headers, request).ipAddress());
        }

        @Test
        @DisplayName("should use the socket address when no proxy is trusted")
        void shouldIgnoreHeadersWhenUntrusted() {
            when(headers.getHeaderString("X-Forwarded-For")).thenReturn("203.0.113.7");

            assertEquals(PROXY, direct().extract(headers, request).ipAddress());
        }

        @Test
        @DisplayName("should ignore forwarding headers from a peer outside the trusted ranges")
        void shouldIgnoreHeadersFromUnlistedPeer() {
            when(headers.getHeaderString("X-Forwarded-For")).thenReturn("203.0.113.7");
            when(headers.getHeaderString("X-Real-IP")).thenReturn("203.0.113.7");
            final var extractor = new ClientContextExtractor(new TrustedProxyValidator(List.of("192.168.0.0/16")));

            assertEquals(PROXY, extractor.extract(headers, request).ipAddress());
        }

        @Test
        @DisplayName("should read the device fingerprint header")
        void shouldReadDevice() {
            when(headers.getHeaderString(ClientContextExtractor.DEVICE_HEADER)).thenReturn(" laptop-42 ");

            final var context = behindProxy().extract(headers, request);

            assertEquals("laptop-42", context.deviceFingerprint());
            assertEquals(PROXY, context.ipAddress());
        }

        @Test
        @DisplayName("should leave a blank fingerprint unset")
        void shouldIgnoreBlankDevice() {
            when(headers.getHeaderString(ClientContextExtractor.DEVICE_HEADER)).thenReturn("  ");

            assertNull(behindProxy().extract(headers, request).deviceFingerprint());
        }
    }

    @Nested
    @DisplayName("forwardedFor()")
    class ForwardedFor {

        @Test
        @DisplayName("should read a plain for parameter")
        void shouldReadPlain() {
            assertEquals("192.0.2.60", ClientContextExtractor.forwardedFor("for=192.0.2.60;proto=http;by=203.0.113.43"));
        }

        @Test
        @DisplayName("should strip the port of an IPv4 address")
        void shouldStripPort() {
            assertEquals("192.0.2.43", ClientContextExtractor.forwardedFor("for=\"192.0.2.43:4711\""));
        }

        @Test
        @DisplayName("should unwrap a bracketed IPv6 address")
        void shouldUnwrapIpv6() {
            assertEquals("2001:db8:cafe::17", ClientContextExtractor.forwardedFor("For=\"[2001:db8:cafe::17]:4711\""));
        }

        @Test
        @DisplayName("should only look at the first hop")
        void shouldUseFirstHop() {
            assertEquals("192.0.2.1", ClientContextExtractor.forwardedFor("for=192.0.2.1, for=198.51.100.17"));
        }

        @Test
        @DisplayName("should return null without a for parameter")
        void shouldReturnNullWithoutFor() {
            assertNull(ClientContextExtractor.forwardedFor("proto=https;by=203.0.113.43"));
        }
    }
}
