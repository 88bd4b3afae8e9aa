package cids.core.model.key;

/**
 * Lifecycle of a token signing key: {@code PENDING -> ACTIVE -> DEPRECATED -> RETIRED}.
 *
 * <p>Keys are never changed in place. Each transition produces a new record.
 */
public enum KeyStatus {
    /** Published but not yet used for signing. */
    PENDING,
    /** Signs new tokens. At most one key is active. */
    ACTIVE,
    /** Grace window: still verifies and is still published in the JWKS. */
    DEPRECATED,
    /** Neither signs nor verifies. Deleted after the retention period. */
    RETIRED;

    public boolean isPublished() {
        return this == ACTIVE || this == DEPRECATED;
    }
}
