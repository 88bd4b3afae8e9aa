package cids.core.service.token;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.function.Consumer;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;

import cids.core.config.TokenConfig;
import cids.core.model.token.IssuedToken;
import cids.core.model.token.TokenIssuanceException;
import cids.core.model.token.TokenType;
import cids.core.port.out.Metrics;
import cids.core.port.out.TokenSigner;

/**
 * Builds the standard claim set shared by every token type and signs it.
 */
@ApplicationScoped
public class TokenMinter {

    private final TokenSigner signer;
    private final TokenConfig config;
    private final Metrics metrics;

    @Inject
    public TokenMinter(TokenSigner signer, TokenConfig config, Metrics metrics) {
        this.signer = signer;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Sign a token.
     *
     * @param type     value of the {@code token_type} claim
     * @param subject  {@code sub}
     * @param audience {@code aud}
     * @param ttl      lifetime, counted from an {@code iat} truncated to whole seconds
     * @param custom   adds the type-specific claims
     * @throws TokenIssuanceException if no signing key is available
     */
    public IssuedToken mint(
            TokenType type, String subject, String audience, Duration ttl, Consumer<JwtClaims> custom) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Token lifetime must be positive");
        }
        final var issuedAt = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        final var expiresAt = issuedAt.plus(ttl).truncatedTo(ChronoUnit.SECONDS);
        final var jti = UUID.randomUUID().toString();

        final var claims = new JwtClaims();
        claims.setIssuer(config.issuer());
        claims.setSubject(subject);
        claims.setAudience(audience);
        claims.setIssuedAt(NumericDate.fromSeconds(issuedAt.getEpochSecond()));
        claims.setNotBefore(NumericDate.fromSeconds(issuedAt.getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));
        claims.setJwtId(jti);
        claims.setStringClaim("token_type", type.claimValue());
        claims.setStringClaim("token_version", config.version());
        if (custom != null) {
            custom.accept(claims);
        }

        final var token = signer.sign(claims);
        metrics.recordTokenIssued(type, audience);
        return new IssuedToken(token, jti, type, subject, audience, issuedAt, expiresAt);
    }
}
