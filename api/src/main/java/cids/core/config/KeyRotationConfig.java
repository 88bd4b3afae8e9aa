package cids.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Signing key lifecycle.
 *
 * <p>The deprecation period is the grace window during which a replaced key still
 * verifies. It must be longer than the longest access or service token lifetime.
 */
@ConfigMapping(prefix = "cids.auth.key-rotation")
public interface KeyRotationConfig {

    /**
     * Whether scheduled rotation and lifecycle processing run.
     *
     * <p>When disabled the broker still signs with its active key and manual rotation
     * stays available through the admin API.
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Quartz cron expression for scheduled rotation. Default: first day of every month.
     */
    @WithDefault("0 0 0 1 * ?")
    String schedule();

    @WithName("cache-refresh-interval")
    @WithDefault("PT5M")
    Duration cacheRefreshInterval();

    /**
     * How often pending keys are activated and deprecated keys retired.
     */
    @WithName("lifecycle-interval")
    @WithDefault("PT15M")
    Duration lifecycleInterval();

    /**
     * How long a scheduled key stays PENDING before it starts signing.
     */
    @WithName("grace-period")
    @WithDefault("PT1H")
    Duration gracePeriod();

    @WithName("deprecation-period")
    @WithDefault("PT2H")
    Duration deprecationPeriod();

    @WithName("retention-period")
    @WithDefault("P7D")
    Duration retentionPeriod();

    @WithName("key-size")
    @WithDefault("2048")
    int keySize();

    /**
     * Static PKCS8 private key used as the initial active key. A key is generated at
     * startup when none is configured.
     */
    @WithName("static-key")
    Optional<String> staticKey();

    @WithName("static-key-id")
    @WithDefault("auth-service-key-1")
    String staticKeyId();
}
