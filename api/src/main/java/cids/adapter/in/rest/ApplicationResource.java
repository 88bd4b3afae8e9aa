package cids.adapter.in.rest;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.PermissionsAllowed;
import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;

import cids.adapter.in.auth.BrokerPermission;
import cids.adapter.in.dto.ApiKeyCreatedResponse;
import cids.adapter.in.dto.ApplicationRequest;
import cids.adapter.in.dto.ApplicationResponse;
import cids.adapter.in.dto.CreateApiKeyRequest;
import cids.adapter.in.problem.BrokerProblem;
import cids.core.model.app.ApiKey;
import cids.core.port.in.ApiKeyManagement;
import cids.core.port.in.ApplicationManagement;

/**
 * Application registry and per-application API keys.
 *
 * <p>Applications are never deleted. {@code DELETE} deactivates.
 */
@Path("/admin/apps")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ApplicationResource {

    private final ApplicationManagement applications;
    private final ApiKeyManagement apiKeys;
    private final SecurityIdentity identity;

    @Inject
    public ApplicationResource(
            ApplicationManagement applications, ApiKeyManagement apiKeys, SecurityIdentity identity) {
        this.applications = applications;
        this.apiKeys = apiKeys;
        this.identity = identity;
    }

    @POST
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> register(@NotNull @Valid ApplicationRequest request) {
        return applications
                .register(request.toApplication())
                .map(app -> Response.status(Response.Status.CREATED)
                        .entity(ApplicationResponse.from(app))
                        .build());
    }

    @GET
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<List<ApplicationResponse>> list() {
        return applications.list().map(apps -> apps.stream().map(ApplicationResponse::from).toList());
    }

    @GET
    @Path("/{clientId}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<ApplicationResponse> get(@PathParam("clientId") String clientId) {
        return applications.get(clientId).map(app -> app.map(ApplicationResponse::from)
                .orElseThrow(() -> BrokerProblem.resourceNotFound("Application", clientId)));
    }

    /**
     * Update an application. Only the fields present in the request change.
     */
    @PUT
    @Path("/{clientId}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<ApplicationResponse> update(
            @PathParam("clientId") String clientId, @NotNull ApplicationRequest request) {
        if (request.clientId() != null && !request.clientId().equals(clientId)) {
            throw BrokerProblem.badRequest("clientId in body does not match path");
        }
        return applications
                .get(clientId)
                .map(app -> app.orElseThrow(() -> BrokerProblem.resourceNotFound("Application", clientId)))
                .flatMap(existing -> applications.update(request.applyTo(existing)))
                .map(ApplicationResponse::from);
    }

    @DELETE
    @Path("/{clientId}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<ApplicationResponse> deactivate(@PathParam("clientId") String clientId) {
        return applications.deactivate(clientId).map(ApplicationResponse::from);
    }

    /**
     * Issue a new client secret. The plaintext is only returned by this call.
     */
    @POST
    @Path("/{clientId}/secret")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Map<String, String>> rotateSecret(@PathParam("clientId") String clientId) {
        return applications.rotateSecret(clientId).map(secret -> Map.of("clientId", clientId, "clientSecret", secret));
    }

    @POST
    @Path("/{clientId}/api-keys")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> createApiKey(@PathParam("clientId") String clientId, @NotNull CreateApiKeyRequest request) {
        final var ttl = request.ttlDays() != null ? Duration.ofDays(request.ttlDays()) : null;
        return apiKeys.create(clientId, request.name(), ttl, creatorId())
                .map(result -> Response.status(Response.Status.CREATED)
                        .entity(ApiKeyCreatedResponse.from(result))
                        .build());
    }

    @GET
    @Path("/{clientId}/api-keys")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<List<ApiKey>> listApiKeys(@PathParam("clientId") String clientId) {
        return apiKeys.list(clientId).map(keys -> keys.stream().map(ApiKey::redacted).toList());
    }

    @DELETE
    @Path("/{clientId}/api-keys/{keyId}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> revokeApiKey(@PathParam("clientId") String clientId, @PathParam("keyId") String keyId) {
        return apiKeys.revoke(clientId, keyId).map(revoked -> {
            if (!revoked) {
                throw BrokerProblem.resourceNotFound("API key", keyId);
            }
            return Response.noContent().build();
        });
    }

    /**
     * Replace a key. The old key keeps working for the configured grace period.
     */
    @POST
    @Path("/{clientId}/api-keys/{keyId}/rotate")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> rotateApiKey(@PathParam("clientId") String clientId, @PathParam("keyId") String keyId) {
        return apiKeys.rotate(clientId, keyId, creatorId())
                .map(result -> Response.status(Response.Status.CREATED)
                        .entity(ApiKeyCreatedResponse.from(result))
                        .build());
    }

    private String creatorId() {
        final var principal = identity.getPrincipal();
        return principal != null ? principal.getName() : "unknown";
    }
}
