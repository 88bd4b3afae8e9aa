package cids.core.model.token;

import java.time.Duration;
import java.time.Instant;

/**
 * A signed token and the claims needed to track it.
 */
public record IssuedToken(
        String token, String jti, TokenType type, String subject, String audience, Instant issuedAt, Instant expiresAt) {

    public long expiresInSeconds() {
        return Duration.between(issuedAt, expiresAt).toSeconds();
    }
}
