package cids.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Discovery reconciliation settings.
 *
 * <pre>{@code
 * cids.discovery.fetch-timeout=PT5S
 * cids.discovery.cache-window=PT60M
 * cids.discovery.retry.max-attempts=3
 * cids.discovery.retry.base-delay=PT1S
 * }</pre>
 */
@ConfigMapping(prefix = "cids.discovery")
public interface DiscoveryConfig {

    /**
     * The only discovery document version accepted.
     */
    @WithName("schema-version")
    @WithDefault("2.0")
    String schemaVersion();

    @WithName("reachability-check-enabled")
    @WithDefault("true")
    boolean reachabilityCheckEnabled();

    @WithName("reachability-timeout")
    @WithDefault("PT5S")
    Duration reachabilityTimeout();

    @WithName("connect-timeout")
    @WithDefault("PT5S")
    Duration connectTimeout();

    /**
     * Ceiling on the whole discovery response.
     */
    @WithName("fetch-timeout")
    @WithDefault("PT5S")
    Duration fetchTimeout();

    @WithName("max-response-bytes")
    @WithDefault("1048576")
    long maxResponseBytes();

    /**
     * A successful discovery newer than this is reused unless the caller forces a refresh.
     */
    @WithName("cache-window")
    @WithDefault("PT60M")
    Duration cacheWindow();

    @WithName("history-size")
    @WithDefault("100")
    int historySize();

    @WithName("history-retention")
    @WithDefault("P30D")
    Duration historyRetention();

    @WithName("batch-concurrency")
    @WithDefault("5")
    int batchConcurrency();

    /**
     * Send a short-lived service token with discovery requests.
     */
    @WithName("authenticate-requests")
    @WithDefault("true")
    boolean authenticateRequests();

    RetryConfig retry();

    interface RetryConfig {

        /**
         * Total attempts, the first one included.
         */
        @WithName("max-attempts")
        @WithDefault("3")
        int maxAttempts();

        @WithName("base-delay")
        @WithDefault("PT1S")
        Duration baseDelay();

        @WithDefault("2.0")
        double multiplier();

        @WithName("max-delay")
        @WithDefault("PT30S")
        Duration maxDelay();

        @WithName("jitter-factor")
        @WithDefault("0.1")
        double jitterFactor();
    }
}
