package cids.adapter.in.rest;

import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.PermissionsAllowed;
import io.smallrye.mutiny.Uni;

import cids.adapter.in.auth.BrokerPermission;
import cids.adapter.in.dto.BatchDiscoveryRequest;
import cids.adapter.in.problem.BrokerProblem;
import cids.core.model.capability.PermissionTree;
import cids.core.model.discovery.DiscoveryAttempt;
import cids.core.model.discovery.DiscoveryResult;
import cids.core.model.discovery.DiscoveryStatistics;
import cids.core.port.in.DiscoveryManagement;

/**
 * Discovery triggers and reporting.
 *
 * <p>A failed discovery is still a 200 with status {@code ERROR} and diagnostics in the body.
 */
@Path("/admin/discovery")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DiscoveryResource {

    private final DiscoveryManagement discovery;

    @Inject
    public DiscoveryResource(DiscoveryManagement discovery) {
        this.discovery = discovery;
    }

    @POST
    @Path("/{clientId}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<DiscoveryResult> discover(
            @PathParam("clientId") String clientId, @QueryParam("force") @DefaultValue("false") boolean force) {
        return discovery.discover(clientId, force);
    }

    @POST
    @Path("/batch")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Map<String, DiscoveryResult>> batch(@NotNull @Valid BatchDiscoveryRequest request) {
        return discovery.batchDiscover(request.clientIds(), request.force());
    }

    @GET
    @Path("/{clientId}/history")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<List<DiscoveryAttempt>> history(
            @PathParam("clientId") String clientId, @QueryParam("limit") @DefaultValue("20") int limit) {
        return discovery.history(clientId, limit);
    }

    @GET
    @Path("/{clientId}/statistics")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<DiscoveryStatistics> statistics(@PathParam("clientId") String clientId) {
        return discovery.statistics(clientId);
    }

    @GET
    @Path("/{clientId}/permissions")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<PermissionTree> permissions(@PathParam("clientId") String clientId) {
        return discovery.permissionTree(clientId).map(tree -> tree.orElseThrow(
                () -> BrokerProblem.notFound("No capability graph discovered for " + clientId)));
    }

    /**
     * Flat permission list, narrowed by resource, action or sensitivity.
     */
    @GET
    @Path("/{clientId}/permissions/search")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<List<String>> searchPermissions(
            @PathParam("clientId") String clientId,
            @QueryParam("q") String query,
            @QueryParam("resource") String resource,
            @QueryParam("action") String action,
            @QueryParam("sensitiveOnly") @DefaultValue("false") boolean sensitiveOnly) {
        return permissions(clientId).map(tree -> {
            final var matches = tree.search(resource, action, sensitiveOnly);
            if (query == null || query.isBlank()) {
                return matches;
            }
            final var textual = tree.search(query);
            return matches.stream().filter(textual::contains).toList();
        });
    }
}
