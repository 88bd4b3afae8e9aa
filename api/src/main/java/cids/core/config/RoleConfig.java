package cids.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

@ConfigMapping(prefix = "cids.roles")
public interface RoleConfig {

    /**
     * How long a role snapshot may be served from cache. Writes invalidate it immediately.
     */
    @WithName("cache-ttl")
    @WithDefault("PT5M")
    Duration cacheTtl();
}
