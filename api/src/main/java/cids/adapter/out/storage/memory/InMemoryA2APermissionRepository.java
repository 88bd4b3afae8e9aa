package cids.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import cids.core.model.a2a.A2APermission;
import cids.core.port.out.A2APermissionRepository;

/**
 * In-memory A2A permissions. Saving a permission for an existing source and target
 * pair replaces the previous entry.
 */
public class InMemoryA2APermissionRepository implements A2APermissionRepository {

    private final ConcurrentHashMap<String, A2APermission> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<A2APermission> save(A2APermission permission) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                storage.values().removeIf(existing -> !existing.id().equals(permission.id())
                        && existing.sourceClientId().equals(permission.sourceClientId())
                        && existing.targetClientId().equals(permission.targetClientId()));
                storage.put(permission.id(), permission);
            }
            return permission;
        });
    }

    @Override
    public Uni<Optional<A2APermission>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(id)));
    }

    @Override
    public Uni<Optional<A2APermission>> findBySourceAndTarget(String sourceClientId, String targetClientId) {
        return Uni.createFrom().item(() -> storage.values().stream()
                .filter(p -> p.sourceClientId().equals(sourceClientId) && p.targetClientId().equals(targetClientId))
                .findFirst());
    }

    @Override
    public Uni<List<A2APermission>> findAll() {
        return Uni.createFrom().item(() -> storage.values().stream()
                .sorted(Comparator.comparing(A2APermission::sourceClientId)
                        .thenComparing(A2APermission::targetClientId))
                .toList());
    }

    @Override
    public Uni<Boolean> delete(String id) {
        return Uni.createFrom().item(() -> storage.remove(id) != null);
    }
}
