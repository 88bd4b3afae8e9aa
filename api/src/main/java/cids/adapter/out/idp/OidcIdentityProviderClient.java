package cids.adapter.out.idp;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import cids.core.cache.CaffeineLocalCache;
import cids.core.cache.LocalCache;
import cids.core.config.IdentityProviderConfig;
import cids.core.model.token.VerifiedPrincipal;
import cids.spi.IdentityProviderClient;

/**
 * Authorization code flow against an OpenID Connect provider.
 *
 * <p>The code is exchanged at the token endpoint and the returned ID token is
 * verified against the provider's JWKS. Keys are cached, and an unknown key ID
 * triggers one forced refresh to follow provider key rotation. Concurrent refreshes
 * share a single fetch.
 */
@ApplicationScoped
public class OidcIdentityProviderClient implements IdentityProviderClient {

    private static final Logger LOG = Logger.getLogger(OidcIdentityProviderClient.class);
    private static final int CLOCK_SKEW_SECONDS = 30;

    private final WebClient webClient;
    private final IdentityProviderConfig config;
    private final LocalCache<URI, JsonWebKeySet> keyCache;
    private final Map<URI, Uni<JsonWebKeySet>> inFlightFetches = new ConcurrentHashMap<>();

    @Inject
    public OidcIdentityProviderClient(Vertx vertx, IdentityProviderConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
        this.keyCache = new CaffeineLocalCache<>(config.jwksCacheTtl(), 10);
    }

    @Override
    public URI authorizationUrl(String redirectUri, String state) {
        final var params = new LinkedHashMap<String, String>();
        params.put("client_id", config.clientId());
        params.put("response_type", "code");
        params.put("redirect_uri", redirectUri);
        params.put("response_mode", "query");
        params.put("scope", config.scope());
        params.put("state", state);
        final var base = config.authorizationUrl();
        return URI.create(base + (base.contains("?") ? "&" : "?") + formEncode(params));
    }

    @Override
    public Uni<VerifiedPrincipal> exchangeCode(String code, String redirectUri) {
        if (code == null || code.isBlank()) {
            return Uni.createFrom().failure(new IdentityProviderException("Authorization code is required"));
        }
        final var params = new LinkedHashMap<String, String>();
        params.put("grant_type", "authorization_code");
        params.put("code", code);
        params.put("redirect_uri", redirectUri);
        params.put("client_id", config.clientId());
        config.clientSecret().ifPresent(secret -> params.put("client_secret", secret));

        LOG.debugv("Exchanging authorization code at {0}", config.tokenUrl());
        return webClient
                .postAbs(config.tokenUrl())
                .timeout(config.timeout().toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .sendBuffer(Buffer.buffer(formEncode(params)))
                .map(OidcIdentityProviderClient::idToken)
                .flatMap(this::verify)
                .onFailure(e -> !(e instanceof IdentityProviderException))
                .transform(e -> {
                    LOG.errorv(e, "Authorization code exchange failed");
                    return new IdentityProviderException("Identity provider exchange failed: " + e.getMessage(), e);
                });
    }

    private static String idToken(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            LOG.warnv("Token endpoint returned {0}: {1}", response.statusCode(), response.bodyAsString());
            throw new IdentityProviderException("Identity provider rejected the code: HTTP " + response.statusCode());
        }
        final var json = response.bodyAsJsonObject();
        final var idToken = json == null ? null : json.getString("id_token");
        if (idToken == null || idToken.isBlank()) {
            throw new IdentityProviderException("Identity provider response missing id_token");
        }
        return idToken;
    }

    Uni<VerifiedPrincipal> verify(String idToken) {
        final String keyId;
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(idToken);
            keyId = jws.getKeyIdHeaderValue();
        } catch (JoseException e) {
            return Uni.createFrom().failure(new IdentityProviderException("Malformed ID token", e));
        }
        final var jwksUri = URI.create(config.jwksUri());
        return keySet(jwksUri, false)
                .flatMap(keys -> findKey(keys, keyId)
                        .map(key -> Uni.createFrom().item(key))
                        .orElseGet(() -> {
                            LOG.infov("ID token key {0} not cached, refreshing {1}", keyId, jwksUri);
                            return keySet(jwksUri, true).map(refreshed -> findKey(refreshed, keyId)
                                    .orElseThrow(() -> new IdentityProviderException(
                                            "ID token signing key not found: " + keyId)));
                        }))
                .map(key -> principal(idToken, key));
    }

    private VerifiedPrincipal principal(String idToken, JsonWebKey key) {
        final var builder = new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds(CLOCK_SKEW_SECONDS)
                .setExpectedAudience(config.clientId())
                .setVerificationKey(key.getKey())
                .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256);
        config.issuer().ifPresentOrElse(builder::setExpectedIssuer, () -> builder.setExpectedIssuer(false, null));
        try {
            final var claims = builder.build().processToClaims(idToken);
            return new VerifiedPrincipal(
                    claims.getSubject(),
                    firstString(claims, "email", "preferred_username", "upn"),
                    firstString(claims, "name"),
                    groups(claims));
        } catch (InvalidJwtException | MalformedClaimException e) {
            throw new IdentityProviderException("ID token rejected: " + e.getMessage(), e);
        }
    }

    private Set<String> groups(JwtClaims claims) {
        final var value = claims.getClaimValue(config.groupsClaim());
        if (value instanceof Iterable<?> values) {
            final var groups = new LinkedHashSet<String>();
            values.forEach(v -> groups.add(String.valueOf(v)));
            return groups;
        }
        if (value instanceof String single && !single.isBlank()) {
            return Set.of(single);
        }
        return Set.of();
    }

    private static String firstString(JwtClaims claims, String... names) {
        for (var name : names) {
            final var value = claims.getClaimValue(name);
            if (value instanceof String s && !s.isBlank()) {
                return s;
            }
        }
        return null;
    }

    private Uni<JsonWebKeySet> keySet(URI jwksUri, boolean forceRefresh) {
        if (!forceRefresh) {
            final var cached = keyCache.get(jwksUri);
            if (cached.isPresent()) {
                return Uni.createFrom().item(cached.get());
            }
        }
        return Uni.createFrom().deferred(() -> inFlightFetches.computeIfAbsent(jwksUri, uri -> fetchKeys(uri)
                .onTermination()
                .invoke(() -> inFlightFetches.remove(uri))
                .memoize()
                .indefinitely()));
    }

    private Uni<JsonWebKeySet> fetchKeys(URI jwksUri) {
        LOG.infov("Fetching identity provider keys from {0}", jwksUri);
        return webClient
                .getAbs(jwksUri.toString())
                .timeout(config.timeout().toMillis())
                .send()
                .map(response -> {
                    if (response.statusCode() != 200) {
                        throw new IdentityProviderException("JWKS endpoint returned " + response.statusCode());
                    }
                    try {
                        return new JsonWebKeySet(response.bodyAsString());
                    } catch (JoseException e) {
                        throw new IdentityProviderException("Malformed JWKS: " + e.getMessage(), e);
                    }
                })
                .invoke(keys -> keyCache.put(jwksUri, keys));
    }

    private static Optional<JsonWebKey> findKey(JsonWebKeySet keySet, String keyId) {
        final var keys = keySet.getJsonWebKeys();
        if (keyId == null) {
            return keys.size() == 1 ? Optional.of(keys.get(0)) : Optional.empty();
        }
        return keys.stream().filter(k -> keyId.equals(k.getKeyId())).findFirst();
    }

    private static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
