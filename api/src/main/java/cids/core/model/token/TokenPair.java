package cids.core.model.token;

import java.time.Instant;

/**
 * Access token plus the opaque refresh token that can renew it.
 */
public record TokenPair(IssuedToken accessToken, String refreshToken, Instant refreshExpiresAt) {

    public long refreshExpiresInSeconds() {
        return refreshExpiresAt.getEpochSecond() - accessToken.issuedAt().getEpochSecond();
    }
}
