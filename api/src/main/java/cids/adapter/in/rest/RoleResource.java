package cids.adapter.in.rest;

import java.util.LinkedHashSet;
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
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.PermissionsAllowed;
import io.smallrye.mutiny.Uni;

import cids.adapter.in.auth.BrokerPermission;
import cids.adapter.in.dto.GrantRequest;
import cids.adapter.in.dto.GroupMappingRequest;
import cids.adapter.in.dto.RlsFilterRequest;
import cids.adapter.in.dto.RoleRequest;
import cids.adapter.in.dto.RoleResponse;
import cids.adapter.in.problem.BrokerProblem;
import cids.core.model.permission.Grant;
import cids.core.model.permission.PermissionCheck;
import cids.core.model.role.GroupRoleMapping;
import cids.core.model.role.ResolvedPermissions;
import cids.core.port.in.RoleManagement;

/**
 * Roles of one application, with their grants, row-level filters and group mappings.
 *
 * <p>Grants are checked against the application's capability graph when one has
 * been discovered.
 */
@Path("/admin/apps/{clientId}")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RoleResource {

    private final RoleManagement roles;

    @Inject
    public RoleResource(RoleManagement roles) {
        this.roles = roles;
    }

    @POST
    @Path("/roles")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> createRole(@PathParam("clientId") String clientId, @NotNull @Valid RoleRequest request) {
        return roles.createRole(request.toRole(clientId))
                .map(role -> Response.status(Response.Status.CREATED)
                        .entity(RoleResponse.from(role))
                        .build());
    }

    @GET
    @Path("/roles")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<List<RoleResponse>> listRoles(@PathParam("clientId") String clientId) {
        return roles.listRoles(clientId).map(list -> list.stream().map(RoleResponse::from).toList());
    }

    @GET
    @Path("/roles/{roleName}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<RoleResponse> getRole(@PathParam("clientId") String clientId, @PathParam("roleName") String roleName) {
        return roles.getRole(clientId, roleName).map(role -> role.map(RoleResponse::from)
                .orElseThrow(() -> BrokerProblem.resourceNotFound("Role", roleName)));
    }

    /**
     * Replace a role's definition. Existing RLS filters are kept.
     */
    @PUT
    @Path("/roles/{roleName}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<RoleResponse> updateRole(
            @PathParam("clientId") String clientId,
            @PathParam("roleName") String roleName,
            @NotNull @Valid RoleRequest request) {
        if (!roleName.equals(request.name())) {
            throw BrokerProblem.badRequest("Role name in body does not match path");
        }
        return roles.getRole(clientId, roleName)
                .map(existing -> existing.orElseThrow(() -> BrokerProblem.resourceNotFound("Role", roleName)))
                .flatMap(existing -> roles.updateRole(request.toRole(clientId)
                        .toBuilder()
                        .rlsFilters(existing.rlsFilters())
                        .createdAt(existing.createdAt())
                        .build()))
                .map(RoleResponse::from);
    }

    @DELETE
    @Path("/roles/{roleName}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> deleteRole(@PathParam("clientId") String clientId, @PathParam("roleName") String roleName) {
        return roles.deleteRole(clientId, roleName).map(deleted -> {
            if (!deleted) {
                throw BrokerProblem.resourceNotFound("Role", roleName);
            }
            return Response.noContent().build();
        });
    }

    @POST
    @Path("/roles/{roleName}/grants")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<RoleResponse> addGrant(
            @PathParam("clientId") String clientId,
            @PathParam("roleName") String roleName,
            @NotNull @Valid GrantRequest request) {
        return roles.addGrant(clientId, roleName, Grant.parse(request.permission())).map(RoleResponse::from);
    }

    @DELETE
    @Path("/roles/{roleName}/grants")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<RoleResponse> removeGrant(
            @PathParam("clientId") String clientId,
            @PathParam("roleName") String roleName,
            @QueryParam("permission") String permission) {
        if (permission == null || permission.isBlank()) {
            throw BrokerProblem.badRequest("permission query parameter is required");
        }
        return roles.removeGrant(clientId, roleName, Grant.parse(permission)).map(RoleResponse::from);
    }

    @POST
    @Path("/roles/{roleName}/filters")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> addFilter(
            @PathParam("clientId") String clientId,
            @PathParam("roleName") String roleName,
            @NotNull @Valid RlsFilterRequest request) {
        return roles.addRlsFilter(clientId, roleName, request.toFilter())
                .map(role -> Response.status(Response.Status.CREATED)
                        .entity(RoleResponse.from(role))
                        .build());
    }

    @DELETE
    @Path("/roles/{roleName}/filters/{filterId}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<RoleResponse> removeFilter(
            @PathParam("clientId") String clientId,
            @PathParam("roleName") String roleName,
            @PathParam("filterId") String filterId) {
        return roles.removeRlsFilter(clientId, roleName, filterId).map(RoleResponse::from);
    }

    @GET
    @Path("/mappings")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<List<GroupRoleMapping>> listMappings(@PathParam("clientId") String clientId) {
        return roles.listMappings(clientId);
    }

    @POST
    @Path("/mappings")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> mapGroup(@PathParam("clientId") String clientId, @NotNull @Valid GroupMappingRequest request) {
        return roles.mapGroup(new GroupRoleMapping(clientId, request.groupName(), request.roleName()))
                .map(mapping -> Response.status(Response.Status.CREATED).entity(mapping).build());
    }

    @DELETE
    @Path("/mappings")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> unmapGroup(
            @PathParam("clientId") String clientId,
            @QueryParam("group") String group,
            @QueryParam("role") String role) {
        return roles.unmapGroup(new GroupRoleMapping(clientId, group, role)).map(removed -> {
            if (!removed) {
                throw BrokerProblem.notFound("No mapping of group '%s' to role '%s'".formatted(group, role));
            }
            return Response.noContent().build();
        });
    }

    /**
     * Dry-run resolution for a set of groups, without issuing a token.
     */
    @GET
    @Path("/resolve")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<ResolvedPermissions> resolve(
            @PathParam("clientId") String clientId, @QueryParam("group") List<String> groups) {
        return roles.resolve(clientId, new LinkedHashSet<>(groups != null ? groups : List.of()));
    }

    @GET
    @Path("/resolve/check")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<PermissionCheck> check(
            @PathParam("clientId") String clientId,
            @QueryParam("group") List<String> groups,
            @QueryParam("permission") String permission) {
        if (permission == null || permission.isBlank()) {
            throw BrokerProblem.badRequest("permission is required");
        }
        return roles.check(clientId, new LinkedHashSet<>(groups != null ? groups : List.of()), permission);
    }

    @GET
    @Path("/stale-grants")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<List<String>> staleGrants(@PathParam("clientId") String clientId) {
        return roles.staleGrants(clientId);
    }
}
