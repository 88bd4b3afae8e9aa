package cids.core.port.out;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

/**
 * Revocation index keyed by {@code jti}.
 *
 * <p>The index is append and lookup only. Entries disappear once the token they
 * block has expired on its own.
 */
public interface TokenRevocationRepository {

    /**
     * Add a revocation entry. Revoking an already revoked jti changes nothing.
     *
     * @return true if the entry was new
     */
    Uni<Boolean> revoke(String jti, Instant expiresAt);

    Uni<Boolean> isRevoked(String jti);

    /**
     * Remove entries whose tokens have expired.
     *
     * @return number of entries removed
     */
    Uni<Integer> purgeExpired(Instant now);

    Uni<Integer> size();
}
