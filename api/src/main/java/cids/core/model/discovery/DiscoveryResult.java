package cids.core.model.discovery;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import cids.core.model.capability.CapabilityGraph;

/**
 * Result of discovering one application.
 *
 * @param clientId    application that was discovered
 * @param status      outcome
 * @param graph       the published or cached graph, null on error
 * @param diagnostics errors and warnings in the order they happened
 * @param attempts    number of fetch attempts made
 * @param latency     total wall time of the run
 * @param completedAt when the run finished
 */
public record DiscoveryResult(
        String clientId,
        DiscoveryStatus status,
        CapabilityGraph graph,
        List<DiscoveryDiagnostic> diagnostics,
        int attempts,
        Duration latency,
        Instant completedAt) {

    public DiscoveryResult {
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        if (latency == null) {
            latency = Duration.ZERO;
        }
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }

    public static DiscoveryResult error(
            String clientId, List<DiscoveryDiagnostic> diagnostics, int attempts, Duration latency) {
        return new DiscoveryResult(clientId, DiscoveryStatus.ERROR, null, diagnostics, attempts, latency, null);
    }

    public boolean isSuccessful() {
        return status != DiscoveryStatus.ERROR;
    }

    public Optional<CapabilityGraph> graphOptional() {
        return Optional.ofNullable(graph);
    }

    /**
     * Classification of the last error, if the run failed.
     */
    public Optional<DiscoveryErrorType> errorType() {
        if (status != DiscoveryStatus.ERROR) {
            return Optional.empty();
        }
        for (int i = diagnostics.size() - 1; i >= 0; i--) {
            if (diagnostics.get(i).errorType() != null) {
                return Optional.of(diagnostics.get(i).errorType());
            }
        }
        return Optional.empty();
    }
}
