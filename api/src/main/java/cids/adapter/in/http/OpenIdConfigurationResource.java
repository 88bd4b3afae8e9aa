package cids.adapter.in.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;

import cids.core.config.TokenConfig;

/**
 * OpenID Provider metadata, enough for resource servers to locate the JWKS.
 */
@Path("/.well-known/openid-configuration")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class OpenIdConfigurationResource {

    private final TokenConfig tokenConfig;

    @Inject
    public OpenIdConfigurationResource(TokenConfig tokenConfig) {
        this.tokenConfig = tokenConfig;
    }

    @GET
    public Map<String, Object> configuration(@Context UriInfo uriInfo) {
        final var base = uriInfo.getBaseUri().toString().replaceAll("/+$", "");
        final var metadata = new LinkedHashMap<String, Object>();
        metadata.put("issuer", tokenConfig.issuer());
        metadata.put("authorization_endpoint", base + "/auth/login");
        metadata.put("token_endpoint", base + "/auth/token");
        metadata.put("jwks_uri", base + "/auth/.well-known/jwks.json");
        metadata.put("revocation_endpoint", base + "/auth/revoke");
        metadata.put("response_types_supported", List.of("code"));
        metadata.put("grant_types_supported", List.of("authorization_code", "refresh_token"));
        metadata.put("subject_types_supported", List.of("public"));
        metadata.put("id_token_signing_alg_values_supported", List.of("RS256"));
        metadata.put("token_endpoint_auth_methods_supported", List.of("client_secret_post"));
        return metadata;
    }
}
