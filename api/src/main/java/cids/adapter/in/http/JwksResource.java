package cids.adapter.in.http;

import java.math.BigInteger;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;

import cids.core.model.key.SigningKey;
import cids.core.service.key.SigningKeyRegistry;

/**
 * Publishes the broker's public signing keys (RFC 7517).
 *
 * <p>Every key valid for verification is listed, so tokens signed before a
 * rotation keep verifying while their key is deprecated.
 */
@Path("/auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class JwksResource {

    private static final Logger LOG = Logger.getLogger(JwksResource.class);
    private static final int CACHE_MAX_AGE_SECONDS = 300;

    private final SigningKeyRegistry keyRegistry;

    @Inject
    public JwksResource(SigningKeyRegistry keyRegistry) {
        this.keyRegistry = keyRegistry;
    }

    /**
     * <pre>{@code
     * { "keys": [ { "kty": "RSA", "kid": "k-20240101-abcd1234", "use": "sig", "alg": "RS256", "n": "...", "e": "AQAB" } ] }
     * }</pre>
     */
    @GET
    @Path("/.well-known/jwks.json")
    public Response getJwks() {
        final var verificationKeys = keyRegistry.getVerificationKeys();
        if (verificationKeys.isEmpty()) {
            LOG.warn("No verification keys available");
            return Response.ok(Map.of("keys", List.of())).build();
        }
        final var jwks = verificationKeys.stream().map(JwksResource::toJwk).toList();
        LOG.debugv("Returning JWKS with {0} keys", jwks.size());
        return Response.ok(Map.of("keys", jwks))
                .header("Cache-Control", "public, max-age=" + CACHE_MAX_AGE_SECONDS)
                .build();
    }

    static Map<String, Object> toJwk(SigningKey key) {
        final var publicKey = key.publicKey();
        return Map.of(
                "kty", "RSA",
                "kid", key.keyId(),
                "use", "sig",
                "alg", "RS256",
                "n", base64UrlEncode(publicKey.getModulus()),
                "e", base64UrlEncode(publicKey.getPublicExponent()));
    }

    /**
     * Unsigned big-endian bytes without the sign byte, base64url encoded (RFC 7518).
     */
    private static String base64UrlEncode(BigInteger value) {
        var bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            final var trimmed = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, trimmed, 0, trimmed.length);
            bytes = trimmed;
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
