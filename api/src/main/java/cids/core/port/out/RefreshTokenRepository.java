package cids.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.token.RefreshTokenRecord;

/**
 * Storage for refresh token families.
 */
public interface RefreshTokenRepository {

    Uni<Void> save(RefreshTokenRecord record);

    Uni<Optional<RefreshTokenRecord>> findByHash(String tokenHash);

    /**
     * Mark {@code currentHash} superseded and store {@code replacement}, as one step.
     *
     * <p>The swap only happens if the current token is still ACTIVE.
     *
     * @return the outcome, carrying the record as it was before the swap
     */
    Uni<RotationOutcome> rotate(String currentHash, RefreshTokenRecord replacement);

    /**
     * Revoke every token of a family.
     *
     * @return the records that were revoked
     */
    Uni<List<RefreshTokenRecord>> revokeFamily(String familyId);

    /**
     * @return number of records removed
     */
    Uni<Integer> deleteExpired(Instant now);

    /**
     * Result of {@link #rotate(String, RefreshTokenRecord)}.
     */
    sealed interface RotationOutcome {
        record Rotated(RefreshTokenRecord previous) implements RotationOutcome {}

        record NotActive(RefreshTokenRecord current) implements RotationOutcome {}

        record NotFound() implements RotationOutcome {}
    }
}
