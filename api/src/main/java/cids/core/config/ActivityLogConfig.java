package cids.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

@ConfigMapping(prefix = "cids.activity")
public interface ActivityLogConfig {

    /**
     * Oldest entries are dropped beyond this size.
     */
    @WithName("max-entries")
    @WithDefault("10000")
    int maxEntries();

    /**
     * Record successful validations. Failed validations are always recorded.
     */
    @WithName("log-validations")
    @WithDefault("false")
    boolean logValidations();
}
