package cids.core.model.token;

import java.time.Instant;
import java.util.Set;

/**
 * Stored refresh token. The plaintext is never kept, only its SHA-256 hash.
 *
 * @param tokenHash       hash of the plaintext token
 * @param familyId        shared by every token descending from one login
 * @param parentTokenHash hash of the token this one replaced, null for the first
 * @param clientId        application the token belongs to
 * @param principal       user snapshot used to re-resolve permissions on refresh
 * @param accessJti       jti of the access token issued alongside
 * @param issuedAt        issue time
 * @param expiresAt       expiry
 * @param state           lifecycle state
 * @param context         binding snapshot from the original login
 */
public record RefreshTokenRecord(
        String tokenHash,
        String familyId,
        String parentTokenHash,
        String clientId,
        VerifiedPrincipal principal,
        String accessJti,
        Instant issuedAt,
        Instant expiresAt,
        RefreshTokenState state,
        ClientContext context) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public RefreshTokenRecord withState(RefreshTokenState newState) {
        return new RefreshTokenRecord(
                tokenHash, familyId, parentTokenHash, clientId, principal, accessJti, issuedAt, expiresAt, newState,
                context);
    }

    public Set<String> groups() {
        return principal.groups();
    }
}
