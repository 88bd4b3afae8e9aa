package cids.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.PermissionsAllowed;
import io.smallrye.mutiny.Uni;

import cids.adapter.in.auth.BrokerPermission;
import cids.adapter.in.dto.KeySummaryResponse;
import cids.adapter.in.dto.RotateKeyRequest;
import cids.adapter.in.problem.BrokerProblem;
import cids.core.service.key.KeyRotationService;

/**
 * Signing key administration.
 *
 * <p>Provides endpoints for:
 * <ul>
 *   <li>Listing all signing keys and their statuses</li>
 *   <li>Triggering an emergency rotation</li>
 *   <li>Deprecating or retiring keys</li>
 * </ul>
 */
@Path("/admin/keys")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SigningKeyResource {

    private final KeyRotationService keyRotationService;

    @Inject
    public SigningKeyResource(KeyRotationService keyRotationService) {
        this.keyRotationService = keyRotationService;
    }

    @GET
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<List<KeySummaryResponse>> listKeys() {
        return keyRotationService
                .listAllKeys()
                .map(keys -> keys.stream().map(KeySummaryResponse::from).toList());
    }

    @GET
    @Path("/{keyId}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<KeySummaryResponse> getKey(@PathParam("keyId") String keyId) {
        return keyRotationService.getKey(keyId).map(KeySummaryResponse::from);
    }

    /**
     * Generate a key and activate it now. The previous key is deprecated and keeps
     * verifying for the grace window.
     */
    @POST
    @Path("/rotate")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> rotateKeys(RotateKeyRequest request) {
        final var reason =
                request != null && request.reason() != null ? request.reason() : "Manual rotation via admin API";
        return keyRotationService.triggerRotation(reason).map(newKey -> Response.status(Response.Status.CREATED)
                .entity(KeySummaryResponse.from(newKey))
                .build());
    }

    @POST
    @Path("/{keyId}/deprecate")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> deprecateKey(@PathParam("keyId") String keyId) {
        return keyRotationService.forceDeprecate(keyId).map(v -> Response.noContent().build());
    }

    /**
     * Retire a key. Tokens it signed stop verifying at once, so {@code force=true} is required.
     */
    @DELETE
    @Path("/{keyId}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> retireKey(@PathParam("keyId") String keyId, @QueryParam("force") boolean force) {
        if (!force) {
            throw BrokerProblem.badRequest("Retiring a key invalidates its tokens; repeat with force=true");
        }
        return keyRotationService.forceRetire(keyId).map(v -> Response.noContent().build());
    }
}
