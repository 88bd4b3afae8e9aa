package cids.core.model.discovery;

import java.time.Duration;
import java.time.Instant;

/**
 * History entry for one discovery run.
 *
 * @param clientId     application that was discovered
 * @param timestamp    when the run finished
 * @param status       outcome
 * @param errorType    classification of the failure, null on success
 * @param message      short human-readable summary
 * @param latency      total wall time of the run
 * @param attempts     number of fetch attempts
 * @param forced       whether the cache window was bypassed
 * @param graphVersion published graph version, null on failure
 */
public record DiscoveryAttempt(
        String clientId,
        Instant timestamp,
        DiscoveryStatus status,
        DiscoveryErrorType errorType,
        String message,
        Duration latency,
        int attempts,
        boolean forced,
        Long graphVersion) {

    public boolean isSuccessful() {
        return status == DiscoveryStatus.SUCCESS || status == DiscoveryStatus.PARTIAL;
    }

    public static DiscoveryAttempt from(DiscoveryResult result, boolean forced) {
        return new DiscoveryAttempt(
                result.clientId(),
                result.completedAt(),
                result.status(),
                result.errorType().orElse(null),
                result.diagnostics().isEmpty()
                        ? result.status().name()
                        : result.diagnostics().get(result.diagnostics().size() - 1).message(),
                result.latency(),
                result.attempts(),
                forced,
                result.graph() != null ? result.graph().version() : null);
    }
}
