package cids.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.a2a.A2APermission;

/**
 * Storage for A2A permissions, unique per source and target pair.
 */
public interface A2APermissionRepository {

    Uni<A2APermission> save(A2APermission permission);

    Uni<Optional<A2APermission>> findById(String id);

    Uni<Optional<A2APermission>> findBySourceAndTarget(String sourceClientId, String targetClientId);

    Uni<List<A2APermission>> findAll();

    Uni<Boolean> delete(String id);
}
