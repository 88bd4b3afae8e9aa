package cids.core.model.discovery;

/**
 * Classification of discovery failures.
 *
 * <p>Only transient classes are retried. Everything else surfaces immediately.
 */
public enum DiscoveryErrorType {
    NETWORK_ERROR(true),
    TIMEOUT_ERROR(true),
    SERVER_ERROR(true),
    AUTHENTICATION_ERROR(false),
    VALIDATION_ERROR(false),
    CONFIGURATION_ERROR(false);

    private final boolean retryable;

    DiscoveryErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
