package cids.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.capability.CapabilityGraph;

/**
 * Current capability graph per application.
 *
 * <p>Publication replaces the whole graph in one step, so a reader sees either the
 * previous graph or the new one and never a mix.
 */
public interface CapabilityGraphRepository {

    /**
     * Replace the application's graph with the draft, assigning the next version.
     *
     * @param draft the new graph, its version is ignored
     * @return the graph as published, carrying its assigned version
     */
    Uni<CapabilityGraph> publish(CapabilityGraph draft);

    Uni<Optional<CapabilityGraph>> findByClient(String clientId);

    Uni<List<CapabilityGraph>> findAll();
}
