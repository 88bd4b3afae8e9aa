package cids.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Claims and lifetimes of issued tokens.
 *
 * <pre>{@code
 * cids.token.issuer=internal-auth-service
 * cids.token.access-ttl=PT15M
 * cids.token.refresh-ttl=P7D
 * cids.token.service-ttl=PT5M
 * }</pre>
 */
@ConfigMapping(prefix = "cids.token")
public interface TokenConfig {

    /**
     * Value of the {@code iss} claim.
     */
    @WithDefault("internal-auth-service")
    String issuer();

    /**
     * Audience of platform-internal tokens, including admin tokens.
     */
    @WithName("internal-audience")
    @WithDefault("internal-services")
    String internalAudience();

    /**
     * Value of the {@code token_version} claim.
     */
    @WithDefault("2.0")
    String version();

    @WithName("access-ttl")
    @WithDefault("PT15M")
    Duration accessTtl();

    @WithName("refresh-ttl")
    @WithDefault("P7D")
    Duration refreshTtl();

    /**
     * Default lifetime of service tokens when the caller does not ask for one.
     */
    @WithName("service-ttl")
    @WithDefault("PT5M")
    Duration serviceTtl();

    /**
     * Hard ceiling on service token lifetime, applied after the A2A permission limit.
     */
    @WithName("service-max-ttl")
    @WithDefault("PT10M")
    Duration serviceMaxTtl();

    /**
     * Tolerance applied to {@code exp} and {@code nbf} checks.
     */
    @WithName("clock-skew")
    @WithDefault("PT30S")
    Duration clockSkew();
}
