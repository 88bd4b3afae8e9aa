package cids.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import cids.core.model.role.GroupRoleMapping;
import cids.core.model.role.Role;
import cids.core.model.role.RoleSnapshot;
import cids.core.port.out.RoleRepository;

/**
 * In-memory roles and group mappings.
 *
 * <p>Each application's data sits in one {@link ClientRoles} guarded by its own
 * monitor, so a snapshot never observes a half-applied write.
 */
public class InMemoryRoleRepository implements RoleRepository {

    private final ConcurrentHashMap<String, ClientRoles> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Role> save(Role role) {
        return Uni.createFrom().item(() -> {
            final var client = client(role.clientId());
            synchronized (client) {
                client.roles.put(role.name(), role);
            }
            return role;
        });
    }

    @Override
    public Uni<Optional<Role>> findByName(String clientId, String roleName) {
        return Uni.createFrom().item(() -> {
            final var client = client(clientId);
            synchronized (client) {
                return Optional.ofNullable(client.roles.get(roleName));
            }
        });
    }

    @Override
    public Uni<Optional<Role>> update(String clientId, String roleName, UnaryOperator<Role> change) {
        return Uni.createFrom().item(() -> {
            final var client = client(clientId);
            synchronized (client) {
                final var current = client.roles.get(roleName);
                if (current == null) {
                    return Optional.empty();
                }
                final var updated = change.apply(current);
                client.roles.put(roleName, updated);
                return Optional.of(updated);
            }
        });
    }

    @Override
    public Uni<List<Role>> findByClient(String clientId) {
        return Uni.createFrom().item(() -> {
            final var client = client(clientId);
            synchronized (client) {
                return List.copyOf(client.roles.values());
            }
        });
    }

    @Override
    public Uni<Boolean> delete(String clientId, String roleName) {
        return Uni.createFrom().item(() -> {
            final var client = client(clientId);
            synchronized (client) {
                final var removed = client.roles.remove(roleName) != null;
                client.mappings.removeIf(m -> m.roleName().equals(roleName));
                return removed;
            }
        });
    }

    @Override
    public Uni<GroupRoleMapping> saveMapping(GroupRoleMapping mapping) {
        return Uni.createFrom().item(() -> {
            final var client = client(mapping.clientId());
            synchronized (client) {
                if (!client.mappings.contains(mapping)) {
                    client.mappings.add(mapping);
                }
            }
            return mapping;
        });
    }

    @Override
    public Uni<Boolean> deleteMapping(GroupRoleMapping mapping) {
        return Uni.createFrom().item(() -> {
            final var client = client(mapping.clientId());
            synchronized (client) {
                return client.mappings.remove(mapping);
            }
        });
    }

    @Override
    public Uni<List<GroupRoleMapping>> findMappings(String clientId) {
        return Uni.createFrom().item(() -> {
            final var client = client(clientId);
            synchronized (client) {
                return List.copyOf(client.mappings);
            }
        });
    }

    @Override
    public Uni<RoleSnapshot> snapshot(String clientId) {
        return Uni.createFrom().item(() -> {
            final var client = client(clientId);
            synchronized (client) {
                return new RoleSnapshot(clientId, List.copyOf(client.roles.values()), List.copyOf(client.mappings));
            }
        });
    }

    private ClientRoles client(String clientId) {
        return storage.computeIfAbsent(clientId, id -> new ClientRoles());
    }

    private static final class ClientRoles {
        private final Map<String, Role> roles = new LinkedHashMap<>();
        private final List<GroupRoleMapping> mappings = new ArrayList<>();
    }
}
