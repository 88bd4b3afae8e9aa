package cids.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Revocation index settings.
 */
@ConfigMapping(prefix = "cids.auth.revocation")
public interface TokenRevocationConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * How long to keep an entry when the token's own expiry is unknown.
     */
    @WithName("default-ttl")
    @WithDefault("PT24H")
    Duration defaultTtl();

    @WithName("sweep-interval")
    @WithDefault("PT5M")
    Duration sweepInterval();
}
