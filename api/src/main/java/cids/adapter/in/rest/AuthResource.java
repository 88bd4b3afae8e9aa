package cids.adapter.in.rest;

import java.time.Duration;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import cids.adapter.in.dto.RefreshRequest;
import cids.adapter.in.dto.RevokeRequest;
import cids.adapter.in.dto.ServiceTokenRequest;
import cids.adapter.in.dto.ServiceTokenResponse;
import cids.adapter.in.dto.TokenExchangeRequest;
import cids.adapter.in.dto.TokenResponse;
import cids.adapter.in.dto.ValidateRequest;
import cids.adapter.in.dto.ValidationResponse;
import cids.adapter.in.http.ClientContextExtractor;
import cids.adapter.in.problem.BrokerProblem;
import cids.core.model.token.TokenValidationResult;
import cids.core.model.token.ValidationContext;
import cids.core.port.in.A2AManagement;
import cids.core.port.in.TokenManagement;
import cids.core.service.common.SecureTokens;

/**
 * Public token endpoints: login, code exchange, refresh, validation, revocation
 * and service tokens.
 */
@Path("/auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String API_KEY_HEADER = "X-API-Key";

    private final TokenManagement tokens;
    private final A2AManagement a2a;
    private final ClientContextExtractor clientContext;

    @Inject
    public AuthResource(TokenManagement tokens, A2AManagement a2a, ClientContextExtractor clientContext) {
        this.tokens = tokens;
        this.a2a = a2a;
        this.clientContext = clientContext;
    }

    /**
     * Redirect the browser to the identity provider.
     */
    @GET
    @Path("/login")
    public Uni<Response> login(
            @QueryParam("client_id") String clientId,
            @QueryParam("redirect_uri") String redirectUri,
            @QueryParam("state") String state) {
        if (clientId == null || clientId.isBlank() || redirectUri == null || redirectUri.isBlank()) {
            throw BrokerProblem.badRequest("client_id and redirect_uri are required");
        }
        final var effectiveState = state != null && !state.isBlank() ? state : SecureTokens.randomUrlSafe(16);
        return tokens.loginUrl(clientId, redirectUri, effectiveState)
                .map(url -> Response.seeOther(url).build());
    }

    @POST
    @Path("/token")
    public Uni<TokenResponse> exchange(
            @NotNull @Valid TokenExchangeRequest request,
            @Context HttpHeaders headers,
            @Context HttpServerRequest httpRequest) {
        return tokens.exchangeCode(
                        request.clientId(),
                        request.code(),
                        request.redirectUri(),
                        request.clientSecret(),
                        clientContext.extract(headers, httpRequest))
                .map(TokenResponse::from);
    }

    @POST
    @Path("/token/refresh")
    public Uni<TokenResponse> refresh(
            @NotNull @Valid RefreshRequest request,
            @Context HttpHeaders headers,
            @Context HttpServerRequest httpRequest) {
        return tokens.refresh(request.refreshToken(), clientContext.extract(headers, httpRequest))
                .map(TokenResponse::from);
    }

    /**
     * Check a token or API key.
     *
     * <p>Rejections answer 401 when the credential is unusable and 403 when it is
     * presented in the wrong context.
     */
    @POST
    @Path("/validate")
    public Uni<Response> validate(
            ValidateRequest request, @Context HttpHeaders headers, @Context HttpServerRequest httpRequest) {
        final var credential = request != null && request.token() != null && !request.token().isBlank()
                ? request.token()
                : bearer(headers);
        if (credential == null) {
            throw BrokerProblem.badRequest("A token is required in the body or the Authorization header");
        }
        final var client = clientContext.extract(headers, httpRequest);
        final var context = request == null
                ? new ValidationContext(null, client.ipAddress(), client.deviceFingerprint())
                : new ValidationContext(
                        request.audience(),
                        isBlank(request.ip()) ? client.ipAddress() : request.ip().trim(),
                        isBlank(request.device()) ? client.deviceFingerprint() : request.device().trim());
        return tokens.validate(credential, context).map(result -> {
            final var status = result instanceof TokenValidationResult.Invalid invalid ? invalid.httpStatus() : 200;
            return Response.status(status).entity(ValidationResponse.from(result)).build();
        });
    }

    /**
     * Revoke an access or refresh token. Unknown tokens are accepted silently.
     */
    @POST
    @Path("/revoke")
    public Uni<Response> revoke(@NotNull @Valid RevokeRequest request) {
        return tokens.revoke(request.token()).map(v -> Response.noContent().build());
    }

    /**
     * Issue a service token to the application owning the presented API key.
     */
    @POST
    @Path("/a2a/token")
    public Uni<ServiceTokenResponse> serviceToken(
            @NotNull @Valid ServiceTokenRequest request, @Context HttpHeaders headers) {
        var apiKey = headers.getHeaderString(API_KEY_HEADER);
        if (apiKey == null || apiKey.isBlank()) {
            apiKey = bearer(headers);
        }
        if (apiKey == null) {
            throw BrokerProblem.unauthorized("An API key is required");
        }
        final var duration = request.durationSeconds() != null ? Duration.ofSeconds(request.durationSeconds()) : null;
        LOG.debugv("Service token requested for {0}", request.targetClientId());
        return a2a.requestServiceToken(
                        apiKey,
                        request.targetClientId(),
                        request.scopes() != null ? request.scopes() : Set.of(),
                        duration)
                .map(ServiceTokenResponse::from);
    }

    private static String bearer(HttpHeaders headers) {
        final var header = headers.getHeaderString(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return null;
        }
        final var token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
