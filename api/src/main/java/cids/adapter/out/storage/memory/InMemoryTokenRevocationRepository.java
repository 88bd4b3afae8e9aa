package cids.adapter.out.storage.memory;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.port.out.TokenRevocationRepository;

/**
 * In-memory revocation index.
 *
 * <p>Revocations are lost on restart and not shared across instances.
 */
public class InMemoryTokenRevocationRepository implements TokenRevocationRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenRevocationRepository.class);

    private final ConcurrentMap<String, Instant> revokedJtis = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> revoke(String jti, Instant expiresAt) {
        return Uni.createFrom().item(() -> {
            final var previous = revokedJtis.putIfAbsent(jti, expiresAt);
            if (previous == null) {
                LOG.debugf("Revoked token in memory: %s (expires: %s)", jti, expiresAt);
                return true;
            }
            return false;
        });
    }

    @Override
    public Uni<Boolean> isRevoked(String jti) {
        return Uni.createFrom().item(() -> revokedJtis.containsKey(jti));
    }

    @Override
    public Uni<Integer> purgeExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            final int before = revokedJtis.size();
            revokedJtis.entrySet().removeIf(entry -> now.isAfter(entry.getValue()));
            return before - revokedJtis.size();
        });
    }

    @Override
    public Uni<Integer> size() {
        return Uni.createFrom().item(revokedJtis::size);
    }
}
