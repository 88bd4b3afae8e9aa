package cids.core.model.discovery;

/**
 * Failure of a single discovery step, carrying its classification.
 */
public class DiscoveryException extends RuntimeException {

    private final DiscoveryErrorType errorType;

    public DiscoveryException(DiscoveryErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public DiscoveryException(DiscoveryErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public DiscoveryErrorType errorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }

    public static DiscoveryException validation(String message) {
        return new DiscoveryException(DiscoveryErrorType.VALIDATION_ERROR, message);
    }

    public static DiscoveryException configuration(String message) {
        return new DiscoveryException(DiscoveryErrorType.CONFIGURATION_ERROR, message);
    }
}
