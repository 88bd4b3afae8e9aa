package cids.core.service.token;

import java.security.PublicKey;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.lang.JoseException;

import cids.core.config.ApiKeyConfig;
import cids.core.config.TokenConfig;
import cids.core.model.activity.ActivityAction;
import cids.core.model.app.ApiKey;
import cids.core.model.key.SigningKey;
import cids.core.model.token.TokenType;
import cids.core.model.token.TokenValidationResult;
import cids.core.model.token.ValidationContext;
import cids.core.model.token.ValidationFailure;
import cids.core.port.in.ApiKeyManagement;
import cids.core.port.out.Metrics;
import cids.core.service.activity.ActivityLogService;
import cids.core.service.key.SigningKeyRegistry;

/**
 * Validates broker-issued JWTs and application API keys.
 *
 * <p>Checks run in a fixed order and the first failure wins: structure, signature,
 * issuer, time window, revocation, audience, then IP and device binding. A token
 * minted elsewhere therefore fails as {@code BAD_SIGNATURE}; one signed by a broker
 * key under another issuer name fails as {@code MALFORMED}. Signatures are
 * checked against the cached ACTIVE and DEPRECATED keys only, so validation does
 * not touch the network.
 */
@ApplicationScoped
public class TokenValidationService {

    private static final Logger LOG = Logger.getLogger(TokenValidationService.class);

    private static final AlgorithmConstraints RS256_ONLY = new AlgorithmConstraints(
            AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256);

    private final SigningKeyRegistry keyRegistry;
    private final TokenRevocationService revocationService;
    private final ApiKeyManagement apiKeys;
    private final TokenConfig tokenConfig;
    private final ApiKeyConfig apiKeyConfig;
    private final ActivityLogService activityLog;
    private final Metrics metrics;

    @Inject
    public TokenValidationService(
            SigningKeyRegistry keyRegistry,
            TokenRevocationService revocationService,
            ApiKeyManagement apiKeys,
            TokenConfig tokenConfig,
            ApiKeyConfig apiKeyConfig,
            ActivityLogService activityLog,
            Metrics metrics) {
        this.keyRegistry = keyRegistry;
        this.revocationService = revocationService;
        this.apiKeys = apiKeys;
        this.tokenConfig = tokenConfig;
        this.apiKeyConfig = apiKeyConfig;
        this.activityLog = activityLog;
        this.metrics = metrics;
    }

    /**
     * Validate a bearer token or an API key.
     *
     * @param credential the token or key, without the {@code Bearer} prefix
     * @param context    expected audience and the presenting request's IP and device
     */
    public Uni<TokenValidationResult> validate(String credential, ValidationContext context) {
        final var ctx = context != null ? context : ValidationContext.forAudience(null);
        if (credential == null || credential.isBlank()) {
            return Uni.createFrom().item(record(TokenValidationResult.invalid(ValidationFailure.MALFORMED, "No credential")));
        }
        if (credential.startsWith(apiKeyConfig.prefix())) {
            return validateApiKey(credential);
        }
        return validateToken(credential.trim(), ctx)
                .map(this::record)
                .call(result -> audit(result, ctx));
    }

    private Uni<TokenValidationResult> validateApiKey(String key) {
        return apiKeys.validate(key).map(found -> found.<TokenValidationResult>map(this::apiKeyResult)
                .orElseGet(() -> TokenValidationResult.invalid(
                        ValidationFailure.INVALID_API_KEY, "API key is unknown, revoked or expired")))
                .map(this::record);
    }

    private TokenValidationResult apiKeyResult(ApiKey key) {
        final var claims = new HashMap<String, Object>();
        claims.put("client_id", key.clientId());
        claims.put("key_id", key.id());
        claims.put("auth_type", "api_key");
        return new TokenValidationResult.Valid(key.clientId(), claims, null, key.expiresAt());
    }

    private Uni<TokenValidationResult> validateToken(String token, ValidationContext ctx) {
        final ParsedToken parsed;
        try {
            parsed = parse(token);
        } catch (TokenRejectedException e) {
            return Uni.createFrom().item(e.result());
        }

        final var signatureFailure = verifySignature(parsed.jws());
        if (signatureFailure != null) {
            return Uni.createFrom().item(signatureFailure);
        }
        final var issuer = parsed.stringClaim("iss");
        if (!tokenConfig.issuer().equals(issuer)) {
            return Uni.createFrom()
                    .item(TokenValidationResult.invalid(
                            ValidationFailure.MALFORMED,
                            "Token issuer '%s' is not this service".formatted(issuer)));
        }

        final var now = Instant.now();
        final var skew = tokenConfig.clockSkew();
        if (now.isAfter(parsed.expiresAt().plus(skew))) {
            return Uni.createFrom().item(TokenValidationResult.invalid(ValidationFailure.EXPIRED, "Token has expired"));
        }
        if (parsed.notBefore() != null && now.plus(skew).isBefore(parsed.notBefore())) {
            return Uni.createFrom()
                    .item(TokenValidationResult.invalid(ValidationFailure.NOT_YET_VALID, "Token is not yet valid"));
        }

        return revocationService.isRevoked(parsed.jti()).map(revoked -> {
            if (revoked) {
                return TokenValidationResult.invalid(ValidationFailure.REVOKED, "Token has been revoked");
            }
            return checkContext(parsed, ctx);
        });
    }

    private TokenValidationResult checkContext(ParsedToken parsed, ValidationContext ctx) {
        final var expected = ctx.expectedAudience() != null ? ctx.expectedAudience() : tokenConfig.internalAudience();
        if (!parsed.audiences().contains(expected)) {
            return TokenValidationResult.invalid(
                    ValidationFailure.WRONG_AUDIENCE, "Token is not intended for " + expected);
        }

        final var boundIp = parsed.stringClaim("bound_ip");
        if (boundIp != null && !boundIp.equals(ctx.ipAddress())) {
            return TokenValidationResult.invalid(
                    ValidationFailure.IP_MISMATCH, "Token is bound to a different IP address");
        }
        final var boundDevice = parsed.stringClaim("bound_device");
        if (boundDevice != null && !boundDevice.equals(ctx.deviceFingerprint())) {
            return TokenValidationResult.invalid(
                    ValidationFailure.DEVICE_MISMATCH, "Token is bound to a different device");
        }

        return new TokenValidationResult.Valid(
                parsed.subject(), parsed.claims().getClaimsMap(), parsed.type(), parsed.expiresAt());
    }

    private ParsedToken parse(String token) {
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(token);
            final var claims = JwtClaims.parse(jws.getUnverifiedPayload());

            final var jti = claims.getJwtId();
            final var exp = claims.getExpirationTime();
            if (jti == null || jti.isBlank() || exp == null) {
                throw rejected(ValidationFailure.MALFORMED, "Token is missing jti or exp");
            }

            final var typeClaim = claims.getStringClaimValue("token_type");
            final var type = typeClaim == null
                    ? TokenType.ACCESS
                    : TokenType.fromClaim(typeClaim)
                            .orElseThrow(() ->
                                    rejected(ValidationFailure.WRONG_TOKEN_TYPE, "Unknown token type " + typeClaim));

            final var nbf = claims.getNotBefore();
            final var audiences = claims.hasAudience() ? claims.getAudience() : List.<String>of();
            return new ParsedToken(
                    jws,
                    claims,
                    jti,
                    claims.getSubject(),
                    type,
                    audiences,
                    Instant.ofEpochSecond(exp.getValue()),
                    nbf != null ? Instant.ofEpochSecond(nbf.getValue()) : null);
        } catch (JoseException | InvalidJwtException | MalformedClaimException e) {
            LOG.debugv("Rejecting malformed token: {0}", e.getMessage());
            throw rejected(ValidationFailure.MALFORMED, "Token could not be parsed");
        }
    }

    /**
     * @return null when a trusted key verifies the signature
     */
    private TokenValidationResult verifySignature(JsonWebSignature jws) {
        final var kid = jws.getKeyIdHeaderValue();
        final var keyed = kid != null ? keyRegistry.getVerificationKey(kid) : Optional.<SigningKey>empty();
        final List<PublicKey> candidates = keyed.isPresent()
                ? List.of(keyed.get().publicKey())
                : keyRegistry.getVerificationKeys().stream()
                        .map(k -> (PublicKey) k.publicKey())
                        .toList();

        for (var key : candidates) {
            try {
                jws.setAlgorithmConstraints(RS256_ONLY);
                jws.setKey(key);
                if (jws.verifySignature()) {
                    return null;
                }
            } catch (JoseException e) {
                LOG.debugv("Signature check failed for kid {0}: {1}", kid, e.getMessage());
            }
        }
        return TokenValidationResult.invalid(
                ValidationFailure.BAD_SIGNATURE, "Signature does not match any trusted key");
    }

    private TokenValidationResult record(TokenValidationResult result) {
        if (result instanceof TokenValidationResult.Invalid invalid) {
            LOG.debugv("Validation failed: {0} ({1})", invalid.failure(), invalid.detail());
            metrics.recordValidation(invalid.failure());
        } else {
            metrics.recordValidation(null);
        }
        return result;
    }

    private Uni<Void> audit(TokenValidationResult result, ValidationContext ctx) {
        if (result instanceof TokenValidationResult.Valid valid) {
            return activityLog.recordValidation(
                    valid.subject(), ctx.expectedAudience(), valid.tokenType(), (String) valid.claims().get("jti"));
        }
        final var invalid = (TokenValidationResult.Invalid) result;
        return activityLog.record(
                ActivityAction.TOKEN_VALIDATED,
                null,
                ctx.expectedAudience(),
                null,
                null,
                Map.of("outcome", invalid.failure().name()));
    }

    private static TokenRejectedException rejected(ValidationFailure failure, String detail) {
        return new TokenRejectedException(TokenValidationResult.invalid(failure, detail));
    }

    private record ParsedToken(
            JsonWebSignature jws,
            JwtClaims claims,
            String jti,
            String subject,
            TokenType type,
            List<String> audiences,
            Instant expiresAt,
            Instant notBefore) {

        String stringClaim(String name) {
            final var value = claims.getClaimValue(name);
            return value != null ? value.toString() : null;
        }
    }

    private static final class TokenRejectedException extends RuntimeException {
        private final TokenValidationResult.Invalid result;

        TokenRejectedException(TokenValidationResult.Invalid result) {
            super(result.detail(), null, false, false);
            this.result = result;
        }

        TokenValidationResult.Invalid result() {
            return result;
        }
    }
}
