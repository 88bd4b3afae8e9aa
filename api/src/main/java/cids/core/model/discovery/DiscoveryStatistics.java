package cids.core.model.discovery;

import java.time.Instant;
import java.util.List;

/**
 * Rolling statistics computed from an application's discovery history.
 */
public record DiscoveryStatistics(
        String clientId,
        int totalAttempts,
        int successes,
        int failures,
        double successRate,
        long averageLatencyMillis,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        DiscoveryErrorType lastErrorType) {

    /**
     * Compute statistics from history entries, newest first.
     */
    public static DiscoveryStatistics from(String clientId, List<DiscoveryAttempt> history) {
        int successes = 0;
        long totalLatency = 0;
        Instant lastSuccess = null;
        Instant lastFailure = null;
        DiscoveryErrorType lastError = null;
        for (var attempt : history) {
            totalLatency += attempt.latency() != null ? attempt.latency().toMillis() : 0;
            if (attempt.isSuccessful()) {
                successes++;
                if (lastSuccess == null) {
                    lastSuccess = attempt.timestamp();
                }
            } else if (lastFailure == null) {
                lastFailure = attempt.timestamp();
                lastError = attempt.errorType();
            }
        }
        final int total = history.size();
        return new DiscoveryStatistics(
                clientId,
                total,
                successes,
                total - successes,
                total == 0 ? 0.0 : (double) successes / total,
                total == 0 ? 0L : totalLatency / total,
                lastSuccess,
                lastFailure,
                lastError);
    }
}
