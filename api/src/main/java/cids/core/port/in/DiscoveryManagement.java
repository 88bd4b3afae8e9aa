package cids.core.port.in;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.capability.PermissionTree;
import cids.core.model.discovery.DiscoveryAttempt;
import cids.core.model.discovery.DiscoveryResult;
import cids.core.model.discovery.DiscoveryStatistics;

/**
 * Use cases for discovering application capabilities.
 */
public interface DiscoveryManagement {

    /**
     * Discover an application.
     *
     * <p>The returned Uni never fails. Failures are reported as a result with status
     * {@code ERROR} and diagnostics.
     *
     * @param force bypass the cache window
     */
    Uni<DiscoveryResult> discover(String clientId, boolean force);

    /**
     * Discover several applications with bounded concurrency. One application's
     * failure never affects the others.
     *
     * @return results keyed by client ID, in request order
     */
    Uni<Map<String, DiscoveryResult>> batchDiscover(List<String> clientIds, boolean force);

    Uni<List<DiscoveryAttempt>> history(String clientId, int limit);

    Uni<DiscoveryStatistics> statistics(String clientId);

    Uni<Optional<PermissionTree>> permissionTree(String clientId);
}
