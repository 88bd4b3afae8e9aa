package cids.adapter.in.rest;

import java.util.List;

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
import io.smallrye.mutiny.Uni;

import cids.adapter.in.auth.BrokerPermission;
import cids.adapter.in.dto.A2APermissionRequest;
import cids.adapter.in.dto.A2APermissionResponse;
import cids.adapter.in.problem.BrokerProblem;
import cids.core.port.in.A2AManagement;

/**
 * Which applications may obtain service tokens for which others.
 */
@Path("/admin/a2a")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class A2APermissionResource {

    private final A2AManagement a2a;

    @Inject
    public A2APermissionResource(A2AManagement a2a) {
        this.a2a = a2a;
    }

    @POST
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> create(@NotNull @Valid A2APermissionRequest request) {
        return a2a.savePermission(request.toPermission(null, null))
                .map(saved -> Response.status(Response.Status.CREATED)
                        .entity(A2APermissionResponse.from(saved))
                        .build());
    }

    @GET
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<List<A2APermissionResponse>> list() {
        return a2a.listPermissions().map(list -> list.stream().map(A2APermissionResponse::from).toList());
    }

    @GET
    @Path("/{id}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<A2APermissionResponse> get(@PathParam("id") String id) {
        return a2a.getPermission(id).map(p -> p.map(A2APermissionResponse::from)
                .orElseThrow(() -> BrokerProblem.resourceNotFound("A2A permission", id)));
    }

    @PUT
    @Path("/{id}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<A2APermissionResponse> update(@PathParam("id") String id, @NotNull @Valid A2APermissionRequest request) {
        return a2a.getPermission(id)
                .map(existing -> existing.orElseThrow(() -> BrokerProblem.resourceNotFound("A2A permission", id)))
                .flatMap(existing -> a2a.savePermission(request.toPermission(id, existing.createdAt())))
                .map(A2APermissionResponse::from);
    }

    @POST
    @Path("/{id}/deactivate")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<A2APermissionResponse> deactivate(@PathParam("id") String id) {
        return a2a.setActive(id, false).map(A2APermissionResponse::from);
    }

    @POST
    @Path("/{id}/activate")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<A2APermissionResponse> activate(@PathParam("id") String id) {
        return a2a.setActive(id, true).map(A2APermissionResponse::from);
    }

    @DELETE
    @Path("/{id}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> delete(@PathParam("id") String id) {
        return a2a.deletePermission(id).map(deleted -> {
            if (!deleted) {
                throw BrokerProblem.resourceNotFound("A2A permission", id);
            }
            return Response.noContent().build();
        });
    }
}
