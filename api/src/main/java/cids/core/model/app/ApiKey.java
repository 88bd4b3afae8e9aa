package cids.core.model.app;

import java.time.Instant;

/**
 * A stored application API key. Only the SHA-256 hash of the key is kept.
 *
 * @param id             short identifier used for display and revocation
 * @param clientId       application the key authenticates
 * @param keyHash        SHA-256 hex of the plaintext key
 * @param displayPrefix  first characters of the plaintext, safe to show
 * @param name           display name
 * @param createdBy      principal that created the key
 * @param createdAt      creation time
 * @param expiresAt      expiry, null for none
 * @param revoked        whether the key was revoked
 * @param graceExpiresAt set after rotation, the key stops working at this time
 */
public record ApiKey(
        String id,
        String clientId,
        String keyHash,
        String displayPrefix,
        String name,
        String createdBy,
        Instant createdAt,
        Instant expiresAt,
        boolean revoked,
        Instant graceExpiresAt) {

    public ApiKey {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("API key ID cannot be null or blank");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("API key client ID cannot be null or blank");
        }
        if (keyHash == null || keyHash.isBlank()) {
            throw new IllegalArgumentException("API key hash cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (createdBy == null) {
            createdBy = "unknown";
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isValid(Instant now) {
        return !revoked
                && (expiresAt == null || now.isBefore(expiresAt))
                && (graceExpiresAt == null || now.isBefore(graceExpiresAt));
    }

    /**
     * Whether the key can be deleted from storage.
     */
    public boolean isExpired(Instant now) {
        return (expiresAt != null && !now.isBefore(expiresAt))
                || (graceExpiresAt != null && !now.isBefore(graceExpiresAt));
    }

    public ApiKey revoke() {
        return new ApiKey(
                id, clientId, keyHash, displayPrefix, name, createdBy, createdAt, expiresAt, true, graceExpiresAt);
    }

    public ApiKey rotatedOut(Instant graceEnd) {
        return new ApiKey(id, clientId, keyHash, displayPrefix, name, createdBy, createdAt, expiresAt, revoked, graceEnd);
    }

    public ApiKey redacted() {
        return new ApiKey(
                id, clientId, "[REDACTED]", displayPrefix, name, createdBy, createdAt, expiresAt, revoked,
                graceExpiresAt);
    }
}
