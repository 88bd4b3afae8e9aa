package cids.core.service.token;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

import cids.core.config.TokenConfig;
import cids.core.config.TokenRevocationConfig;
import cids.core.model.activity.ActivityAction;
import cids.core.model.token.TokenType;
import cids.core.port.out.TokenRevocationRepository;
import cids.core.service.activity.ActivityLogService;

/**
 * Maintains the revocation index.
 *
 * <p>Entries live until the revoked token would be rejected as expired anyway,
 * which is its expiry plus the validator's clock skew. The periodic sweep removes
 * them after that.
 */
@ApplicationScoped
public class TokenRevocationService {

    private static final Logger LOG = Logger.getLogger(TokenRevocationService.class);

    private final TokenRevocationConfig config;
    private final TokenConfig tokenConfig;
    private final TokenRevocationRepository repository;
    private final ActivityLogService activityLog;

    @Inject
    public TokenRevocationService(
            TokenRevocationConfig config,
            TokenConfig tokenConfig,
            TokenRevocationRepository repository,
            ActivityLogService activityLog) {
        this.config = config;
        this.tokenConfig = tokenConfig;
        this.repository = repository;
        this.activityLog = activityLog;
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    public Uni<Boolean> isRevoked(String jti) {
        if (!config.enabled() || jti == null || jti.isBlank()) {
            return Uni.createFrom().item(false);
        }
        return repository.isRevoked(jti);
    }

    /**
     * Revoke a token by its jti. Revoking it again changes nothing.
     *
     * @param jti       the JWT ID
     * @param expiresAt token expiry, or null to keep the entry for the default TTL
     * @return true if the jti was not revoked before
     */
    public Uni<Boolean> revokeJti(String jti, Instant expiresAt) {
        return store(jti, expiresAt).call(newly -> newly
                ? activityLog.record(ActivityAction.TOKEN_REVOKED, null, null, null, jti)
                : Uni.createFrom().voidItem());
    }

    /**
     * Revoke a JWT presented in full. The claims are read without checking the
     * signature, since blocking a forged token is harmless.
     *
     * @throws IllegalArgumentException through the Uni if the token is not a JWT with a jti
     */
    public Uni<Boolean> revokeToken(String token) {
        return Uni.createFrom().item(() -> RevocationTarget.of(readUnverified(token))).flatMap(target -> store(
                        target.jti(), target.expiresAt())
                .call(newly -> newly
                        ? activityLog.record(
                                ActivityAction.TOKEN_REVOKED,
                                target.subject(),
                                target.audience(),
                                target.type(),
                                target.jti())
                        : Uni.createFrom().voidItem()));
    }

    private Uni<Boolean> store(String jti, Instant expiresAt) {
        if (jti == null || jti.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("jti is required"));
        }
        if (!config.enabled()) {
            LOG.warn("Token revocation is disabled, ignoring revoke request");
            return Uni.createFrom().item(false);
        }
        final var effectiveExpiresAt =
                expiresAt != null ? expiresAt.plus(tokenConfig.clockSkew()) : Instant.now().plus(config.defaultTtl());
        return repository.revoke(jti, effectiveExpiresAt).invoke(newly -> {
            if (newly) {
                LOG.infov("Revoked token {0} (entry expires {1})", jti, effectiveExpiresAt);
            } else {
                LOG.debugv("Token {0} was already revoked", jti);
            }
        });
    }

    @Scheduled(
            every = "${cids.auth.revocation.sweep-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Integer> sweepExpired() {
        return repository
                .purgeExpired(Instant.now())
                .invoke(removed -> {
                    if (removed > 0) {
                        LOG.infov("Purged {0} expired revocation entries", removed);
                    }
                })
                .onFailure()
                .invoke(e -> LOG.error("Revocation sweep failed", e));
    }

    static JwtClaims readUnverified(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Token is required");
        }
        try {
            return new JwtConsumerBuilder()
                    .setSkipSignatureVerification()
                    .setDisableRequireSignature()
                    .setSkipAllValidators()
                    .build()
                    .processToClaims(token);
        } catch (InvalidJwtException e) {
            throw new IllegalArgumentException("Token is not a valid JWT", e);
        }
    }

    private record RevocationTarget(String jti, Instant expiresAt, String subject, String audience, TokenType type) {

        static RevocationTarget of(JwtClaims claims) {
            try {
                final var exp = claims.getExpirationTime();
                final var audiences = claims.getAudience();
                return new RevocationTarget(
                        claims.getJwtId(),
                        exp != null ? Instant.ofEpochSecond(exp.getValue()) : null,
                        claims.getSubject(),
                        audiences == null || audiences.isEmpty() ? null : audiences.get(0),
                        TokenType.fromClaim(claims.getStringClaimValue("token_type")).orElse(null));
            } catch (MalformedClaimException e) {
                throw new IllegalArgumentException("Malformed token claims", e);
            }
        }
    }
}
