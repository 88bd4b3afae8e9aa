package cids.core.service.token;

import java.net.URI;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.config.TokenConfig;
import cids.core.model.activity.ActivityAction;
import cids.core.model.app.Application;
import cids.core.model.app.ClientAuthenticationException;
import cids.core.model.role.ResolvedPermissions;
import cids.core.model.token.ClientContext;
import cids.core.model.token.IssuedToken;
import cids.core.model.token.RefreshTokenException;
import cids.core.model.token.RefreshTokenRecord;
import cids.core.model.token.RefreshTokenState;
import cids.core.model.token.TokenPair;
import cids.core.model.token.TokenType;
import cids.core.model.token.TokenValidationResult;
import cids.core.model.token.ValidationContext;
import cids.core.model.token.VerifiedPrincipal;
import cids.core.port.in.ApplicationManagement;
import cids.core.port.in.RoleManagement;
import cids.core.port.in.TokenManagement;
import cids.core.port.out.Metrics;
import cids.core.port.out.RefreshTokenRepository;
import cids.core.port.out.RefreshTokenRepository.RotationOutcome;
import cids.core.service.activity.ActivityLogService;
import cids.core.service.common.SecureTokens;
import cids.spi.IdentityProviderClient;

/**
 * Issues user tokens and rotates refresh tokens.
 *
 * <p>Access tokens are JWTs carrying the resolved permissions and row filters of the
 * user for one application. Refresh tokens are opaque, stored hashed, and grouped in
 * families. Each refresh token can be exchanged once; presenting an exchanged one
 * again revokes the whole family together with the access tokens it produced.
 */
@ApplicationScoped
public class TokenIssuanceService implements TokenManagement {

    private static final Logger LOG = Logger.getLogger(TokenIssuanceService.class);
    private static final int REFRESH_TOKEN_BYTES = 48;

    private final TokenMinter minter;
    private final TokenValidationService validationService;
    private final TokenRevocationService revocationService;
    private final ApplicationManagement applications;
    private final RoleManagement roles;
    private final RefreshTokenRepository refreshTokens;
    private final IdentityProviderClient identityProvider;
    private final ActivityLogService activityLog;
    private final TokenConfig config;
    private final Metrics metrics;

    @Inject
    public TokenIssuanceService(
            TokenMinter minter,
            TokenValidationService validationService,
            TokenRevocationService revocationService,
            ApplicationManagement applications,
            RoleManagement roles,
            RefreshTokenRepository refreshTokens,
            IdentityProviderClient identityProvider,
            ActivityLogService activityLog,
            TokenConfig config,
            Metrics metrics) {
        this.minter = minter;
        this.validationService = validationService;
        this.revocationService = revocationService;
        this.applications = applications;
        this.roles = roles;
        this.refreshTokens = refreshTokens;
        this.identityProvider = identityProvider;
        this.activityLog = activityLog;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<URI> loginUrl(String clientId, String redirectUri, String state) {
        return applications.requireActive(clientId).map(app -> {
            requireRedirect(app, redirectUri);
            return identityProvider.authorizationUrl(redirectUri, state);
        });
    }

    @Override
    public Uni<TokenPair> exchangeCode(
            String clientId, String code, String redirectUri, String clientSecret, ClientContext context) {
        if (code == null || code.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Authorization code is required"));
        }
        return applications.requireActive(clientId).flatMap(app -> {
            requireRedirect(app, redirectUri);
            if (app.clientSecretHash() != null && !SecureTokens.matchesHash(clientSecret, app.clientSecretHash())) {
                LOG.warnv("Client secret mismatch for {0}", clientId);
                throw new ClientAuthenticationException("Invalid client credentials");
            }
            return identityProvider
                    .exchangeCode(code, redirectUri)
                    .flatMap(principal -> issue(app, principal, context));
        });
    }

    @Override
    public Uni<TokenPair> issueUserToken(VerifiedPrincipal principal, String clientId, ClientContext context) {
        return applications.requireActive(clientId).flatMap(app -> issue(app, principal, context));
    }

    private Uni<TokenPair> issue(Application app, VerifiedPrincipal principal, ClientContext context) {
        final var ctx = context != null ? context : ClientContext.none();
        return roles.resolve(app.clientId(), principal.groups()).flatMap(resolved -> {
            final var access = accessToken(app, principal, resolved, ctx);
            final var refreshToken = SecureTokens.randomUrlSafe(REFRESH_TOKEN_BYTES);
            final var record = new RefreshTokenRecord(
                    SecureTokens.sha256Hex(refreshToken),
                    UUID.randomUUID().toString(),
                    null,
                    app.clientId(),
                    principal,
                    access.jti(),
                    access.issuedAt(),
                    access.issuedAt().plus(config.refreshTtl()),
                    RefreshTokenState.ACTIVE,
                    ctx);

            LOG.infov(
                    "Issued access token {0} for {1} to {2} with {3} permissions",
                    access.jti(), principal.subject(), app.clientId(), resolved.permissions().size());
            return refreshTokens
                    .save(record)
                    .call(() -> activityLog.record(
                            ActivityAction.TOKEN_ISSUED,
                            principal.subject(),
                            app.clientId(),
                            TokenType.ACCESS,
                            access.jti(),
                            Map.of("roles", String.join(",", resolved.roles()))))
                    .replaceWith(new TokenPair(access, refreshToken, record.expiresAt()));
        });
    }

    @Override
    public Uni<TokenPair> refresh(String refreshToken, ClientContext context) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return Uni.createFrom()
                    .failure(new RefreshTokenException(
                            RefreshTokenException.Reason.REFRESH_INVALID, "Refresh token is required"));
        }
        final var ctx = context != null ? context : ClientContext.none();
        final var hash = SecureTokens.sha256Hex(refreshToken);
        return refreshTokens.findByHash(hash).flatMap(found -> {
            final var current = found.orElseThrow(() -> new RefreshTokenException(
                    RefreshTokenException.Reason.REFRESH_INVALID, "Unknown refresh token"));
            if (current.state() == RefreshTokenState.SUPERSEDED) {
                return reuseDetected(current);
            }
            if (current.state() == RefreshTokenState.REVOKED) {
                throw new RefreshTokenException(RefreshTokenException.Reason.REFRESH_INVALID, "Refresh token revoked");
            }
            if (current.isExpired(Instant.now())) {
                throw new RefreshTokenException(RefreshTokenException.Reason.REFRESH_EXPIRED, "Refresh token expired");
            }
            return applications.requireActive(current.clientId()).flatMap(app -> rotate(app, current, ctx));
        });
    }

    private Uni<TokenPair> rotate(Application app, RefreshTokenRecord current, ClientContext ctx) {
        return roles.resolve(app.clientId(), current.groups()).flatMap(resolved -> {
            final var access = accessToken(app, current.principal(), resolved, ctx);
            final var nextToken = SecureTokens.randomUrlSafe(REFRESH_TOKEN_BYTES);
            final var next = new RefreshTokenRecord(
                    SecureTokens.sha256Hex(nextToken),
                    current.familyId(),
                    current.tokenHash(),
                    app.clientId(),
                    current.principal(),
                    access.jti(),
                    access.issuedAt(),
                    current.expiresAt(),
                    RefreshTokenState.ACTIVE,
                    ctx);

            return refreshTokens.rotate(current.tokenHash(), next).flatMap(outcome -> {
                if (outcome instanceof RotationOutcome.Rotated) {
                    LOG.debugv("Rotated refresh token of family {0}", current.familyId());
                    return activityLog
                            .record(
                                    ActivityAction.TOKEN_REFRESHED,
                                    current.principal().subject(),
                                    app.clientId(),
                                    TokenType.ACCESS,
                                    access.jti(),
                                    Map.of("family_id", current.familyId()))
                            .replaceWith(new TokenPair(access, nextToken, next.expiresAt()));
                }
                if (outcome instanceof RotationOutcome.NotActive notActive
                        && notActive.current().state() == RefreshTokenState.SUPERSEDED) {
                    return reuseDetected(notActive.current());
                }
                throw new RefreshTokenException(
                        RefreshTokenException.Reason.REFRESH_INVALID, "Refresh token is no longer valid");
            });
        });
    }

    private Uni<TokenPair> reuseDetected(RefreshTokenRecord record) {
        LOG.warnv(
                "Refresh token reuse detected for {0} on {1}, revoking family {2}",
                record.principal().subject(), record.clientId(), record.familyId());
        metrics.recordRefreshReuse(record.clientId());
        return revokeFamily(record.familyId())
                .call(() -> activityLog.record(
                        ActivityAction.TOKEN_REFRESH_REUSE_DETECTED,
                        record.principal().subject(),
                        record.clientId(),
                        TokenType.REFRESH,
                        null,
                        Map.of("family_id", record.familyId())))
                .map(v -> {
                    throw new RefreshTokenException(
                            RefreshTokenException.Reason.REFRESH_REUSED, "Refresh token was already used");
                });
    }

    @Override
    public Uni<TokenValidationResult> validate(String credential, ValidationContext context) {
        return validationService.validate(credential, context);
    }

    /**
     * Revoke a token presented by its holder. JWTs go to the revocation index. A
     * refresh token revokes its whole family. Unknown refresh tokens are ignored.
     */
    @Override
    public Uni<Void> revoke(String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Token is required"));
        }
        if (token.chars().filter(c -> c == '.').count() == 2) {
            return revocationService.revokeToken(token).replaceWithVoid();
        }
        return refreshTokens.findByHash(SecureTokens.sha256Hex(token)).flatMap(found -> found
                .map(record -> revokeFamily(record.familyId()))
                .orElseGet(() -> Uni.createFrom().voidItem()));
    }

    /**
     * Revoke a refresh family and the access tokens issued from it.
     */
    public Uni<Void> revokeFamily(String familyId) {
        return refreshTokens.revokeFamily(familyId).flatMap(revoked -> {
            LOG.infov("Revoked {0} refresh tokens of family {1}", revoked.size(), familyId);
            final List<Uni<Boolean>> revocations = revoked.stream()
                    .filter(r -> r.accessJti() != null)
                    .map(r -> revocationService.revokeJti(r.accessJti(), r.issuedAt().plus(config.accessTtl())))
                    .toList();
            if (revocations.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            return Uni.join().all(revocations).andFailFast().replaceWithVoid();
        });
    }

    @Scheduled(every = "1h", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Integer> purgeExpiredRefreshTokens() {
        return refreshTokens.deleteExpired(Instant.now()).invoke(removed -> {
            if (removed > 0) {
                LOG.infov("Deleted {0} expired refresh tokens", removed);
            }
        });
    }

    private IssuedToken accessToken(
            Application app, VerifiedPrincipal principal, ResolvedPermissions resolved, ClientContext ctx) {
        return minter.mint(TokenType.ACCESS, principal.subject(), app.clientId(), config.accessTtl(), claims -> {
            if (principal.email() != null) {
                claims.setStringClaim("email", principal.email());
            }
            if (principal.name() != null) {
                claims.setStringClaim("name", principal.name());
            }
            claims.setStringListClaim("permissions", resolved.permissions());
            claims.setClaim("rls_filters", new HashMap<>(resolved.rlsFilters()));
            claims.setClaim("rls_operators", new HashMap<>(resolved.rlsOperators()));
            claims.setStringListClaim("roles", resolved.roles());
            claims.setClaim("graph_version", resolved.graphVersion());
            if (app.ipBinding() && ctx.ipAddress() != null) {
                claims.setStringClaim("bound_ip", ctx.ipAddress());
            }
            if (app.deviceBinding() && ctx.deviceFingerprint() != null) {
                claims.setStringClaim("bound_device", ctx.deviceFingerprint());
            }
        });
    }

    private static void requireRedirect(Application app, String redirectUri) {
        if (!app.isRedirectUriAllowed(redirectUri)) {
            throw new IllegalArgumentException("Redirect URI is not registered for " + app.clientId());
        }
    }
}
