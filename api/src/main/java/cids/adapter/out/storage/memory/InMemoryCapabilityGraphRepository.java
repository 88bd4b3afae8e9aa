package cids.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import cids.core.model.capability.CapabilityGraph;
import cids.core.port.out.CapabilityGraphRepository;

/**
 * In-memory capability graphs. Publication swaps the map entry in a single
 * {@link ConcurrentHashMap#compute} call, which also assigns the version.
 */
public class InMemoryCapabilityGraphRepository implements CapabilityGraphRepository {

    private final ConcurrentHashMap<String, CapabilityGraph> graphs = new ConcurrentHashMap<>();

    @Override
    public Uni<CapabilityGraph> publish(CapabilityGraph draft) {
        return Uni.createFrom().item(() -> graphs.compute(
                draft.clientId(), (clientId, previous) -> draft.withVersion(previous == null ? 1 : previous.version() + 1)));
    }

    @Override
    public Uni<Optional<CapabilityGraph>> findByClient(String clientId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(graphs.get(clientId)));
    }

    @Override
    public Uni<List<CapabilityGraph>> findAll() {
        return Uni.createFrom().item(() -> graphs.values().stream()
                .sorted(Comparator.comparing(CapabilityGraph::clientId))
                .toList());
    }
}
