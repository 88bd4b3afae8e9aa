package cids.core.model.discovery;

import java.time.Instant;

/**
 * Structured message produced while discovering an application.
 *
 * @param severity  error or warning
 * @param errorType classification for errors, null for warnings
 * @param message   human-readable message
 * @param attempt   the attempt number that produced it, 0 when not tied to an attempt
 * @param timestamp when it was produced
 */
public record DiscoveryDiagnostic(
        Severity severity, DiscoveryErrorType errorType, String message, int attempt, Instant timestamp) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public static DiscoveryDiagnostic error(DiscoveryErrorType type, String message, int attempt) {
        return new DiscoveryDiagnostic(Severity.ERROR, type, message, attempt, Instant.now());
    }

    public static DiscoveryDiagnostic warning(String message) {
        return new DiscoveryDiagnostic(Severity.WARNING, null, message, 0, Instant.now());
    }
}
