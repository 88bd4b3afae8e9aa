package cids.core.port.out;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import io.smallrye.mutiny.Uni;

/**
 * Outbound HTTP calls to application discovery endpoints.
 *
 * <p>Connection failures fail the Uni with a {@link cids.core.model.discovery.DiscoveryException}
 * of type {@code NETWORK_ERROR}, timeouts with {@code TIMEOUT_ERROR}, and bodies over the
 * size limit with {@code VALIDATION_ERROR}. Any HTTP response, whatever its status, is
 * returned as an item.
 */
public interface DiscoveryClient {

    /**
     * Lightweight reachability check.
     *
     * @return the HTTP status the endpoint answered with
     */
    Uni<Integer> checkReachable(URI endpoint, Duration timeout);

    Uni<DiscoveryResponse> fetch(URI endpoint, Map<String, String> headers, Duration timeout, long maxBytes);

    record DiscoveryResponse(int statusCode, String body) {}
}
