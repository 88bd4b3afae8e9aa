package cids.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import cids.core.model.discovery.DiscoveryAttempt;
import cids.core.port.out.DiscoveryHistoryRepository;

/**
 * In-memory discovery history, one bounded deque per application with the newest entry first.
 */
public class InMemoryDiscoveryHistoryRepository implements DiscoveryHistoryRepository {

    private final ConcurrentHashMap<String, Deque<DiscoveryAttempt>> history = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> append(DiscoveryAttempt attempt, int capacity) {
        return Uni.createFrom().item(() -> {
            history.compute(attempt.clientId(), (clientId, entries) -> {
                final var deque = entries != null ? entries : new ArrayDeque<DiscoveryAttempt>();
                deque.addFirst(attempt);
                while (deque.size() > Math.max(1, capacity)) {
                    deque.removeLast();
                }
                return deque;
            });
            return null;
        });
    }

    @Override
    public Uni<List<DiscoveryAttempt>> findByClient(String clientId, int limit) {
        return Uni.createFrom().item(() -> {
            final var result = new ArrayList<DiscoveryAttempt>();
            history.computeIfPresent(clientId, (id, entries) -> {
                entries.stream().limit(limit).forEach(result::add);
                return entries;
            });
            return result;
        });
    }

    @Override
    public Uni<Optional<DiscoveryAttempt>> findLastSuccessful(String clientId) {
        return findByClient(clientId, Integer.MAX_VALUE).map(entries -> entries.stream()
                .filter(DiscoveryAttempt::isSuccessful)
                .findFirst());
    }

    @Override
    public Uni<Integer> purgeOlderThan(Instant cutoff) {
        return Uni.createFrom().item(() -> {
            final int[] removed = {0};
            for (var clientId : List.copyOf(history.keySet())) {
                history.computeIfPresent(clientId, (id, entries) -> {
                    final int before = entries.size();
                    entries.removeIf(a -> a.timestamp().isBefore(cutoff));
                    removed[0] += before - entries.size();
                    return entries.isEmpty() ? null : entries;
                });
            }
            return removed[0];
        });
    }
}
