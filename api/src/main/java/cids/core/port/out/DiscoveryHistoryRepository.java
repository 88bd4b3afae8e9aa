package cids.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.discovery.DiscoveryAttempt;

/**
 * Bounded per-application discovery history.
 */
public interface DiscoveryHistoryRepository {

    /**
     * Append an entry, dropping the oldest entries beyond {@code capacity}.
     */
    Uni<Void> append(DiscoveryAttempt attempt, int capacity);

    /**
     * Entries for an application, newest first.
     */
    Uni<List<DiscoveryAttempt>> findByClient(String clientId, int limit);

    Uni<Optional<DiscoveryAttempt>> findLastSuccessful(String clientId);

    /**
     * @return number of entries removed
     */
    Uni<Integer> purgeOlderThan(Instant cutoff);
}
