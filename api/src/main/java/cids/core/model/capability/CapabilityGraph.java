package cids.core.model.capability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of an application's discovered capabilities.
 *
 * <p>A graph is never mutated after it is published. Rediscovery publishes a new
 * graph with a higher version, and readers holding the previous instance keep a
 * coherent view of it.
 *
 * @param clientId     owning application
 * @param appName      application display name reported by discovery
 * @param version      monotonically increasing version, assigned at publication
 * @param lastUpdated  last-updated timestamp reported by the application
 * @param discoveredAt when this snapshot was fetched
 * @param endpoints    discovered endpoints
 * @param fields       field metadata keyed by resource then field name
 */
public record CapabilityGraph(
        String clientId,
        String appName,
        long version,
        Instant lastUpdated,
        Instant discoveredAt,
        List<Endpoint> endpoints,
        Map<String, Map<String, FieldMetadata>> fields) {

    public CapabilityGraph {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Graph client ID cannot be null or blank");
        }
        endpoints = endpoints != null ? List.copyOf(endpoints) : List.of();
        fields = copyFields(fields);
        if (discoveredAt == null) {
            discoveredAt = Instant.now();
        }
    }

    /**
     * Copy of this graph carrying the given version.
     */
    public CapabilityGraph withVersion(long newVersion) {
        return new CapabilityGraph(clientId, appName, newVersion, lastUpdated, discoveredAt, endpoints, fields);
    }

    public Set<String> resources() {
        final var resources = new LinkedHashSet<String>();
        endpoints.forEach(e -> resources.add(e.resource()));
        return Collections.unmodifiableSet(resources);
    }

    public Set<String> actions(String resource) {
        final var actions = new LinkedHashSet<String>();
        for (var endpoint : endpoints) {
            if (endpoint.resource().equals(resource)) {
                actions.add(endpoint.action());
            }
        }
        return Collections.unmodifiableSet(actions);
    }

    public boolean hasResource(String resource) {
        return endpoints.stream().anyMatch(e -> e.resource().equals(resource));
    }

    public boolean hasAction(String resource, String action) {
        return endpoints.stream().anyMatch(e -> e.matches(resource, action));
    }

    /**
     * All fields declared for a resource, in declaration order.
     */
    public Map<String, FieldMetadata> fields(String resource) {
        return fields.getOrDefault(resource, Map.of());
    }

    /**
     * Fields reachable through an action on a resource: the union of the response
     * fields of every endpoint performing that action, in declaration order. An
     * action whose endpoints return no fields reaches nothing.
     */
    public Map<String, FieldMetadata> fieldsFor(String resource, String action) {
        final var returned = new LinkedHashSet<String>();
        for (var endpoint : endpoints) {
            if (endpoint.matches(resource, action)) {
                returned.addAll(endpoint.responseFields());
            }
        }
        if (returned.isEmpty()) {
            return Map.of();
        }
        final var reachable = new LinkedHashMap<String, FieldMetadata>();
        fields(resource).forEach((name, metadata) -> {
            if (returned.contains(name)) {
                reachable.put(name, metadata);
            }
        });
        return Collections.unmodifiableMap(reachable);
    }

    public Optional<FieldMetadata> field(String resource, String fieldName) {
        return Optional.ofNullable(fields(resource).get(fieldName));
    }

    public int fieldCount() {
        return fields.values().stream().mapToInt(Map::size).sum();
    }

    private static Map<String, Map<String, FieldMetadata>> copyFields(Map<String, Map<String, FieldMetadata>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        final var copy = new LinkedHashMap<String, Map<String, FieldMetadata>>();
        source.forEach((resource, byName) -> copy.put(
                resource, Collections.unmodifiableMap(new LinkedHashMap<>(byName != null ? byName : Map.of()))));
        return Collections.unmodifiableMap(copy);
    }
}
