package cids.adapter.in.rest;

import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.PermissionsAllowed;
import io.smallrye.mutiny.Uni;

import cids.adapter.in.auth.BrokerPermission;
import cids.adapter.in.problem.BrokerProblem;
import cids.core.model.activity.ActivityAction;
import cids.core.model.activity.ActivityEntry;
import cids.core.model.activity.ActivityQuery;
import cids.core.service.activity.ActivityLogService;
import cids.core.service.token.TokenIssuanceService;
import cids.core.service.token.TokenRevocationService;

/**
 * Revocation administration and the activity log.
 */
@Path("/admin/tokens")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class TokenAdminResource {

    private final TokenRevocationService revocationService;
    private final TokenIssuanceService issuanceService;
    private final ActivityLogService activityLog;

    @Inject
    public TokenAdminResource(
            TokenRevocationService revocationService,
            TokenIssuanceService issuanceService,
            ActivityLogService activityLog) {
        this.revocationService = revocationService;
        this.issuanceService = issuanceService;
        this.activityLog = activityLog;
    }

    /**
     * Revoke a token by its ID. Revoking twice is not an error.
     */
    @DELETE
    @Path("/{jti}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> revoke(@PathParam("jti") String jti) {
        ensureEnabled();
        return revocationService.revokeJti(jti, null).map(v -> Response.noContent().build());
    }

    @GET
    @Path("/{jti}/status")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Map<String, Object>> status(@PathParam("jti") String jti) {
        return revocationService.isRevoked(jti).map(revoked -> Map.of("jti", jti, "revoked", revoked));
    }

    /**
     * Revoke every refresh token of a login session and the access tokens they issued.
     */
    @DELETE
    @Path("/families/{familyId}")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<Response> revokeFamily(@PathParam("familyId") String familyId) {
        return issuanceService.revokeFamily(familyId).map(v -> Response.noContent().build());
    }

    @GET
    @Path("/activity")
    @PermissionsAllowed(BrokerPermission.ADMIN)
    public Uni<List<ActivityEntry>> activity(
            @QueryParam("subject") String subject,
            @QueryParam("clientId") String clientId,
            @QueryParam("action") String action,
            @QueryParam("limit") @DefaultValue("100") int limit) {
        return activityLog.query(new ActivityQuery(subject, clientId, parseAction(action), limit));
    }

    private static ActivityAction parseAction(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (var action : ActivityAction.values()) {
            if (action.value().equals(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw BrokerProblem.badRequest("Unknown activity action: " + value);
    }

    private void ensureEnabled() {
        if (!revocationService.isEnabled()) {
            throw BrokerProblem.featureDisabled("Token revocation");
        }
    }
}
