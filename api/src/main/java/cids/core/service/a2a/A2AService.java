package cids.core.service.a2a;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.config.TokenConfig;
import cids.core.model.a2a.A2AErrorType;
import cids.core.model.a2a.A2AException;
import cids.core.model.a2a.A2APermission;
import cids.core.model.a2a.ServiceTokenGrant;
import cids.core.model.activity.ActivityAction;
import cids.core.model.app.Application;
import cids.core.model.common.EntityConflictException;
import cids.core.model.common.EntityNotFoundException;
import cids.core.model.token.TokenType;
import cids.core.port.in.A2AManagement;
import cids.core.port.in.ApiKeyManagement;
import cids.core.port.in.ApplicationManagement;
import cids.core.port.out.A2APermissionRepository;
import cids.core.port.out.Metrics;
import cids.core.service.activity.ActivityLogService;
import cids.core.service.common.SecureTokens;
import cids.core.service.token.TokenMinter;

/**
 * Issues service tokens between applications.
 *
 * <p>The caller is identified by its API key. A token is only issued when an active
 * permission exists for the source and target pair and every requested scope is
 * allowed by it. An over-broad request is denied as a whole, never narrowed.
 */
@ApplicationScoped
public class A2AService implements A2AManagement {

    private static final Logger LOG = Logger.getLogger(A2AService.class);
    private static final int A2A_ID_LENGTH = 16;

    private final ApiKeyManagement apiKeys;
    private final ApplicationManagement applications;
    private final A2APermissionRepository repository;
    private final TokenMinter minter;
    private final ActivityLogService activityLog;
    private final TokenConfig tokenConfig;
    private final Metrics metrics;

    @Inject
    public A2AService(
            ApiKeyManagement apiKeys,
            ApplicationManagement applications,
            A2APermissionRepository repository,
            TokenMinter minter,
            ActivityLogService activityLog,
            TokenConfig tokenConfig,
            Metrics metrics) {
        this.apiKeys = apiKeys;
        this.applications = applications;
        this.repository = repository;
        this.minter = minter;
        this.activityLog = activityLog;
        this.tokenConfig = tokenConfig;
        this.metrics = metrics;
    }

    @Override
    public Uni<ServiceTokenGrant> requestServiceToken(
            String apiKey, String targetClientId, Set<String> requestedScopes, Duration duration) {
        if (duration != null && (duration.isNegative() || duration.isZero())) {
            return Uni.createFrom().failure(new IllegalArgumentException("Duration must be positive"));
        }
        return authenticate(apiKey)
                .flatMap(source -> repository
                        .findBySourceAndTarget(source.clientId(), targetClientId)
                        .flatMap(permission -> {
                            final var active = permission.filter(A2APermission::active).orElseThrow(() ->
                                    new A2AException(
                                            A2AErrorType.NO_PERMISSION,
                                            "No active A2A permission from " + source.clientId() + " to "
                                                    + targetClientId));
                            return requireActiveTarget(targetClientId)
                                    .map(target -> issue(source, active, requestedScopes, duration));
                        })
                        .onFailure(A2AException.class)
                        .call(e -> denied(source.clientId(), targetClientId, (A2AException) e)))
                .onFailure(A2AException.class)
                .call(e -> {
                    final var denial = (A2AException) e;
                    metrics.recordA2ADenied(denial.errorType().name());
                    return denial.errorType() == A2AErrorType.INVALID_API_KEY
                            ? denied(null, targetClientId, denial)
                            : Uni.createFrom().voidItem();
                })
                .call(grant -> activityLog.record(
                        ActivityAction.A2A_TOKEN_ISSUED,
                        grant.sourceClientId(),
                        grant.targetClientId(),
                        TokenType.SERVICE,
                        grant.token().jti(),
                        Map.of("a2a_id", grant.a2aId(), "scopes", String.join(" ", grant.scopes()))));
    }

    private Uni<Application> authenticate(String apiKey) {
        return apiKeys.validate(apiKey).flatMap(key -> {
            if (key.isEmpty()) {
                throw new A2AException(A2AErrorType.INVALID_API_KEY, "API key is unknown, revoked or expired");
            }
            return applications.get(key.get().clientId()).map(app -> app.filter(Application::active)
                    .orElseThrow(() -> new A2AException(A2AErrorType.INVALID_API_KEY, "Calling application is inactive")));
        });
    }

    private Uni<Application> requireActiveTarget(String targetClientId) {
        return applications.get(targetClientId).map(app -> app.filter(Application::active)
                .orElseThrow(() -> new A2AException(
                        A2AErrorType.TARGET_INACTIVE, "Target application is unknown or inactive: " + targetClientId)));
    }

    private ServiceTokenGrant issue(
            Application source, A2APermission permission, Set<String> requestedScopes, Duration requested) {
        final var scopes = grantedScopes(permission, requestedScopes);
        final var ttl = clampDuration(requested, permission.maxTokenDuration());
        final var a2aId = "a2a_" + SecureTokens.randomHex(A2A_ID_LENGTH);

        final var token = minter.mint(
                TokenType.SERVICE, source.clientId(), permission.targetClientId(), ttl, claims -> {
                    claims.setStringClaim("a2a_id", a2aId);
                    claims.setStringClaim("source_client_id", source.clientId());
                    claims.setStringListClaim("scopes", List.copyOf(scopes));
                    claims.setStringClaim("scope", String.join(" ", scopes));
                });

        LOG.infov(
                "Issued service token {0} ({1}) from {2} to {3}, ttl {4}",
                token.jti(), a2aId, source.clientId(), permission.targetClientId(), ttl);
        return new ServiceTokenGrant(token, a2aId, source.clientId(), permission.targetClientId(), scopes);
    }

    /**
     * The scopes to carry: all allowed ones when none are requested.
     *
     * @throws A2AException with {@link A2AErrorType#SCOPE_DENIED} if any scope is not allowed
     */
    static Set<String> grantedScopes(A2APermission permission, Set<String> requestedScopes) {
        if (requestedScopes == null || requestedScopes.isEmpty()) {
            return new TreeSet<>(permission.allowedScopes());
        }
        final var denied = new TreeSet<>(requestedScopes);
        denied.removeAll(permission.allowedScopes());
        if (!denied.isEmpty()) {
            throw new A2AException(A2AErrorType.SCOPE_DENIED, "Scopes not allowed: " + denied, denied);
        }
        return new TreeSet<>(requestedScopes);
    }

    Duration clampDuration(Duration requested, Duration permissionMax) {
        var ttl = requested != null ? requested : tokenConfig.serviceTtl();
        if (ttl.compareTo(permissionMax) > 0) {
            ttl = permissionMax;
        }
        if (ttl.compareTo(tokenConfig.serviceMaxTtl()) > 0) {
            ttl = tokenConfig.serviceMaxTtl();
        }
        return ttl;
    }

    private Uni<Void> denied(String sourceClientId, String targetClientId, A2AException e) {
        LOG.warnv("A2A token denied from {0} to {1}: {2}", sourceClientId, targetClientId, e.getMessage());
        return activityLog.record(
                ActivityAction.A2A_TOKEN_DENIED,
                sourceClientId,
                targetClientId,
                TokenType.SERVICE,
                null,
                Map.of("reason", e.errorType().name()));
    }

    @Override
    public Uni<A2APermission> savePermission(A2APermission permission) {
        return Uni.combine()
                .all()
                .unis(applications.get(permission.sourceClientId()), applications.get(permission.targetClientId()))
                .asTuple()
                .flatMap(apps -> {
                    if (apps.getItem1().isEmpty()) {
                        throw new EntityNotFoundException("Application", permission.sourceClientId());
                    }
                    if (apps.getItem2().isEmpty()) {
                        throw new EntityNotFoundException("Application", permission.targetClientId());
                    }
                    return repository.findBySourceAndTarget(permission.sourceClientId(), permission.targetClientId());
                })
                .flatMap(existing -> {
                    if (existing.isPresent() && !existing.get().id().equals(permission.id())) {
                        throw new EntityConflictException("A2A permission already exists for "
                                + permission.sourceClientId() + " -> " + permission.targetClientId() + ": "
                                + existing.get().id());
                    }
                    LOG.infov(
                            "Saving A2A permission {0}: {1} -> {2} scopes {3}",
                            permission.id(),
                            permission.sourceClientId(),
                            permission.targetClientId(),
                            permission.allowedScopes());
                    return repository.save(permission);
                });
    }

    @Override
    public Uni<A2APermission> setActive(String id, boolean active) {
        return repository.findById(id).flatMap(existing -> {
            final var permission = existing.orElseThrow(() -> new EntityNotFoundException("A2A permission", id));
            LOG.infov("Setting A2A permission {0} active={1}", id, active);
            return repository.save(permission.withActive(active));
        });
    }

    @Override
    public Uni<Optional<A2APermission>> getPermission(String id) {
        return repository.findById(id);
    }

    @Override
    public Uni<List<A2APermission>> listPermissions() {
        return repository.findAll();
    }

    @Override
    public Uni<Boolean> deletePermission(String id) {
        return repository.delete(id);
    }
}
