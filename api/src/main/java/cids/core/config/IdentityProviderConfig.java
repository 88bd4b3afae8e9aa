package cids.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * OpenID Connect identity provider used for user login.
 */
@ConfigMapping(prefix = "cids.identity-provider")
public interface IdentityProviderConfig {

    @WithName("authorization-url")
    @WithDefault("https://login.example.com/oauth2/v2.0/authorize")
    String authorizationUrl();

    @WithName("token-url")
    @WithDefault("https://login.example.com/oauth2/v2.0/token")
    String tokenUrl();

    @WithName("jwks-uri")
    @WithDefault("https://login.example.com/discovery/v2.0/keys")
    String jwksUri();

    Optional<String> issuer();

    @WithName("client-id")
    @WithDefault("cids")
    String clientId();

    @WithName("client-secret")
    Optional<String> clientSecret();

    @WithDefault("openid profile email")
    String scope();

    @WithName("groups-claim")
    @WithDefault("groups")
    String groupsClaim();

    @WithName("jwks-cache-ttl")
    @WithDefault("PT1H")
    Duration jwksCacheTtl();

    @WithDefault("PT10S")
    Duration timeout();
}
