package cids.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.token.RefreshTokenRecord;
import cids.core.model.token.RefreshTokenState;
import cids.core.port.out.RefreshTokenRepository;

/**
 * In-memory refresh token families.
 *
 * <p>All access goes through one lock so that rotation and family revocation are atomic.
 */
public class InMemoryRefreshTokenRepository implements RefreshTokenRepository {

    private final Map<String, RefreshTokenRecord> byHash = new HashMap<>();
    private final Object lock = new Object();

    @Override
    public Uni<Void> save(RefreshTokenRecord record) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                byHash.put(record.tokenHash(), record);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<RefreshTokenRecord>> findByHash(String tokenHash) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                return Optional.ofNullable(byHash.get(tokenHash));
            }
        });
    }

    @Override
    public Uni<RotationOutcome> rotate(String currentHash, RefreshTokenRecord replacement) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final var current = byHash.get(currentHash);
                if (current == null) {
                    return new RotationOutcome.NotFound();
                }
                if (current.state() != RefreshTokenState.ACTIVE) {
                    return new RotationOutcome.NotActive(current);
                }
                byHash.put(currentHash, current.withState(RefreshTokenState.SUPERSEDED));
                byHash.put(replacement.tokenHash(), replacement);
                return new RotationOutcome.Rotated(current);
            }
        });
    }

    @Override
    public Uni<List<RefreshTokenRecord>> revokeFamily(String familyId) {
        return Uni.createFrom().item(() -> {
            final var revoked = new ArrayList<RefreshTokenRecord>();
            synchronized (lock) {
                byHash.replaceAll((hash, record) -> {
                    if (record.familyId().equals(familyId) && record.state() != RefreshTokenState.REVOKED) {
                        revoked.add(record);
                        return record.withState(RefreshTokenState.REVOKED);
                    }
                    return record;
                });
            }
            return revoked;
        });
    }

    @Override
    public Uni<Integer> deleteExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            synchronized (lock) {
                final int before = byHash.size();
                byHash.values().removeIf(record -> record.isExpired(now));
                return before - byHash.size();
            }
        });
    }
}
