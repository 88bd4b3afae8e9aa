package cids.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import cids.core.model.a2a.A2AException;
import cids.core.model.app.ClientAuthenticationException;
import cids.core.model.common.EntityConflictException;
import cids.core.model.common.EntityNotFoundException;
import cids.core.model.discovery.DiscoveryException;
import cids.core.model.token.RefreshTokenException;
import cids.core.model.token.TokenIssuanceException;
import cids.core.service.key.KeyRotationService.KeyNotFoundException;
import cids.spi.IdentityProviderClient.IdentityProviderException;

/**
 * Maps domain exceptions to RFC 7807 Problem Details.
 *
 * <p>Client errors are logged at debug level only.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(BrokerProblem.validationError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalStateException(IllegalStateException e) {
        LOG.debugv("State error: {0}", e.getMessage());
        return toResponse(BrokerProblem.badRequest(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapEntityNotFound(EntityNotFoundException e) {
        return toResponse(BrokerProblem.resourceNotFound(e.entityType(), e.entityId()));
    }

    @ServerExceptionMapper
    public Response mapKeyNotFound(KeyNotFoundException e) {
        return toResponse(BrokerProblem.notFound(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapEntityConflict(EntityConflictException e) {
        LOG.debugv("Conflict: {0}", e.getMessage());
        return toResponse(BrokerProblem.conflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapClientAuthentication(ClientAuthenticationException e) {
        return toResponse(BrokerProblem.unauthorized(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapRefreshToken(RefreshTokenException e) {
        LOG.debugv("Refresh rejected ({0}): {1}", e.reason(), e.getMessage());
        return toResponse(BrokerProblem.refreshRejected(e.reason().name(), e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapA2A(A2AException e) {
        LOG.debugv("Service token denied ({0}): {1}", e.errorType(), e.getMessage());
        return toResponse(BrokerProblem.a2aDenied(
                e.errorType().httpStatus(), e.errorType().name(), e.getMessage(), e.deniedScopes()));
    }

    @ServerExceptionMapper
    public Response mapDiscovery(DiscoveryException e) {
        return toResponse(switch (e.errorType()) {
            case VALIDATION_ERROR -> BrokerProblem.validationError(e.getMessage());
            case CONFIGURATION_ERROR -> BrokerProblem.badRequest(e.getMessage());
            default -> BrokerProblem.badGateway(e.getMessage());
        });
    }

    @ServerExceptionMapper
    public Response mapIdentityProvider(IdentityProviderException e) {
        LOG.warnv("Identity provider failure: {0}", e.getMessage());
        return toResponse(BrokerProblem.badGateway(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapTokenIssuance(TokenIssuanceException e) {
        LOG.errorv(e, "Token issuance failed");
        return toResponse(BrokerProblem.serviceUnavailable("Token issuance unavailable: " + e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
