package cids.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Application API keys.
 */
@ConfigMapping(prefix = "cids.api-keys")
public interface ApiKeyConfig {

    @WithDefault("cids_ak_")
    String prefix();

    /**
     * Longest lifetime a key may be created with. Unlimited when not set.
     */
    @WithName("max-ttl")
    Optional<Duration> maxTtl();

    /**
     * How long a rotated-out key keeps working.
     */
    @WithName("rotation-grace-period")
    @WithDefault("PT24H")
    Duration rotationGracePeriod();
}
