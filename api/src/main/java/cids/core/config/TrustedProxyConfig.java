package cids.core.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithName;

/**
 * Proxies whose forwarding headers ({@code X-Forwarded-For}, {@code Forwarded},
 * {@code X-Real-IP}) are believed when deriving the caller IP.
 *
 * <p>Without any entry the socket address is always used.
 */
@ConfigMapping(prefix = "cids.http")
public interface TrustedProxyConfig {

    /** @return trusted proxy IPs or CIDR ranges, e.g. {@code 10.0.0.0/8} */
    @WithName("trusted-proxies")
    Optional<List<String>> trustedProxies();
}
