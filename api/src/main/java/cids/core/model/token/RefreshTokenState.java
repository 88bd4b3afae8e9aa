package cids.core.model.token;

/**
 * State of a stored refresh token.
 */
public enum RefreshTokenState {
    /** Can be exchanged once. */
    ACTIVE,
    /** Already exchanged. Presenting it again is treated as theft. */
    SUPERSEDED,
    /** Revoked individually or with its family. */
    REVOKED
}
