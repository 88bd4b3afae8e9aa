package cids.core.service.role;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.cache.CaffeineLocalCache;
import cids.core.cache.LocalCache;
import cids.core.config.RoleConfig;
import cids.core.model.capability.CapabilityGraph;
import cids.core.model.common.EntityConflictException;
import cids.core.model.common.EntityNotFoundException;
import cids.core.model.permission.Grant;
import cids.core.model.permission.PermissionCheck;
import cids.core.model.permission.PermissionCoverage;
import cids.core.model.role.GroupRoleMapping;
import cids.core.model.role.ResolvedPermissions;
import cids.core.model.role.RlsFilter;
import cids.core.model.role.Role;
import cids.core.model.role.RoleSnapshot;
import cids.core.port.in.RoleManagement;
import cids.core.port.out.CapabilityGraphRepository;
import cids.core.port.out.RoleRepository;
import cids.core.service.permission.PermissionResolver;

/**
 * Roles, grants, row filters and group mappings of each application.
 *
 * <p>Grants are checked against the application's capability graph when one has been
 * discovered. Before the first discovery they are accepted as they are.
 *
 * <p>Resolution reads one role snapshot per application, cached for the configured
 * TTL and dropped on every write through this service. Each write also bumps the
 * application's generation, so a snapshot loaded before a write is never cached
 * after it.
 */
@ApplicationScoped
public class RoleService implements RoleManagement {

    private static final Logger LOG = Logger.getLogger(RoleService.class);
    private static final long SNAPSHOT_CACHE_SIZE = 1_000;

    private final RoleRepository repository;
    private final CapabilityGraphRepository graphRepository;
    private final PermissionResolver resolver = new PermissionResolver();
    private final LocalCache<String, RoleSnapshot> snapshots;
    private final ConcurrentMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    @Inject
    public RoleService(RoleRepository repository, CapabilityGraphRepository graphRepository, RoleConfig config) {
        this.repository = repository;
        this.graphRepository = graphRepository;
        this.snapshots = new CaffeineLocalCache<>(config.cacheTtl(), SNAPSHOT_CACHE_SIZE);
    }

    @Override
    public Uni<Role> createRole(Role role) {
        return graphRepository.findByClient(role.clientId()).flatMap(graph -> {
            validateRole(role, graph.orElse(null));
            return repository.findByClient(role.clientId()).flatMap(existing -> {
                if (existing.stream().anyMatch(r -> r.name().equals(role.name()))) {
                    return Uni.createFrom()
                            .failure(new EntityConflictException(
                                    "Role already exists: " + role.clientId() + "/" + role.name()));
                }
                requireSingleDefault(role, existing);
                LOG.infov("Creating role {0} for {1}", role.name(), role.clientId());
                return repository.save(role).invoke(() -> invalidate(role.clientId()));
            });
        });
    }

    @Override
    public Uni<Role> updateRole(Role role) {
        return graphRepository.findByClient(role.clientId()).flatMap(graph -> {
            validateRole(role, graph.orElse(null));
            return repository.findByClient(role.clientId()).flatMap(existing -> {
                final var current = existing.stream()
                        .filter(r -> r.name().equals(role.name()))
                        .findFirst()
                        .orElseThrow(() -> new EntityNotFoundException("Role", role.clientId() + "/" + role.name()));
                requireSingleDefault(role, existing);
                LOG.infov("Updating role {0} for {1}", role.name(), role.clientId());
                return repository
                        .save(role.toBuilder()
                                .createdAt(current.createdAt())
                                .updatedAt(Instant.now())
                                .build())
                        .invoke(() -> invalidate(role.clientId()));
            });
        });
    }

    @Override
    public Uni<Boolean> deleteRole(String clientId, String roleName) {
        return repository.delete(clientId, roleName).invoke(deleted -> {
            if (deleted) {
                LOG.infov("Deleted role {0} of {1} with its grants, filters and mappings", roleName, clientId);
                invalidate(clientId);
            }
        });
    }

    @Override
    public Uni<Optional<Role>> getRole(String clientId, String roleName) {
        return repository.findByName(clientId, roleName);
    }

    @Override
    public Uni<List<Role>> listRoles(String clientId) {
        return repository.findByClient(clientId);
    }

    @Override
    public Uni<Role> addGrant(String clientId, String roleName, Grant grant) {
        return graphRepository.findByClient(clientId).flatMap(graph -> {
            validateGrant(grant, graph.orElse(null));
            return mutate(clientId, roleName, role -> {
                if (role.grants().contains(grant)) {
                    return role;
                }
                final var grants = new ArrayList<>(role.grants());
                grants.add(grant);
                return role.withGrants(grants);
            });
        });
    }

    @Override
    public Uni<Role> removeGrant(String clientId, String roleName, Grant grant) {
        return mutate(clientId, roleName, role -> role.withGrants(role.grants().stream()
                .filter(g -> !g.equals(grant))
                .toList()));
    }

    @Override
    public Uni<Role> addRlsFilter(String clientId, String roleName, RlsFilter filter) {
        return graphRepository.findByClient(clientId).flatMap(graph -> {
            validateFilter(filter, graph.orElse(null));
            return mutate(clientId, roleName, role -> {
                final var filters = new ArrayList<>(role.rlsFilters().stream()
                        .filter(f -> !f.id().equals(filter.id()))
                        .toList());
                filters.add(filter);
                return role.withRlsFilters(filters);
            });
        });
    }

    @Override
    public Uni<Role> removeRlsFilter(String clientId, String roleName, String filterId) {
        return mutate(clientId, roleName, role -> role.withRlsFilters(role.rlsFilters().stream()
                .filter(f -> !f.id().equals(filterId))
                .toList()));
    }

    @Override
    public Uni<GroupRoleMapping> mapGroup(GroupRoleMapping mapping) {
        return repository.findByName(mapping.clientId(), mapping.roleName()).flatMap(role -> {
            if (role.isEmpty()) {
                return Uni.createFrom()
                        .failure(new EntityNotFoundException("Role", mapping.clientId() + "/" + mapping.roleName()));
            }
            LOG.infov("Mapping group {0} to role {1} of {2}", mapping.groupName(), mapping.roleName(), mapping.clientId());
            return repository.saveMapping(mapping).invoke(() -> invalidate(mapping.clientId()));
        });
    }

    @Override
    public Uni<Boolean> unmapGroup(GroupRoleMapping mapping) {
        return repository.deleteMapping(mapping).invoke(removed -> {
            if (removed) {
                invalidate(mapping.clientId());
            }
        });
    }

    @Override
    public Uni<List<GroupRoleMapping>> listMappings(String clientId) {
        return repository.findMappings(clientId);
    }

    @Override
    public Uni<ResolvedPermissions> resolve(String clientId, Set<String> groups) {
        return Uni.combine()
                .all()
                .unis(snapshot(clientId), graphRepository.findByClient(clientId))
                .asTuple()
                .map(tuple -> {
                    final var resolved = resolver.resolve(groups, tuple.getItem1(), tuple.getItem2().orElse(null));
                    if (!resolved.staleReferences().isEmpty()) {
                        LOG.debugv("Ignored stale grants for {0}: {1}", clientId, resolved.staleReferences());
                    }
                    return resolved;
                });
    }

    @Override
    public Uni<PermissionCheck> check(String clientId, Set<String> groups, String permission) {
        return Uni.combine()
                .all()
                .unis(snapshot(clientId), graphRepository.findByClient(clientId))
                .asTuple()
                .map(tuple -> {
                    final var graph = tuple.getItem2().orElse(null);
                    final var resolved = resolver.resolve(groups, tuple.getItem1(), graph);
                    final var granted = PermissionCoverage.permits(resolved.permissions(), permission, graph);
                    return new PermissionCheck(permission, granted, resolved.roles(), resolved.graphVersion());
                });
    }

    @Override
    public Uni<List<String>> staleGrants(String clientId) {
        return Uni.combine()
                .all()
                .unis(repository.findByClient(clientId), graphRepository.findByClient(clientId))
                .asTuple()
                .map(tuple -> resolver.staleGrants(tuple.getItem1(), tuple.getItem2().orElse(null)));
    }

    /**
     * Drop the cached snapshot of an application.
     */
    public void invalidate(String clientId) {
        generation(clientId).incrementAndGet();
        snapshots.invalidate(clientId);
    }

    private Uni<RoleSnapshot> snapshot(String clientId) {
        final var cached = snapshots.get(clientId);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached.get());
        }
        final var generation = generation(clientId);
        final long loadedAt = generation.get();
        return repository.snapshot(clientId).invoke(snapshot -> {
            snapshots.put(clientId, snapshot);
            // a write that raced the load may have missed the put; undo it
            if (generation.get() != loadedAt) {
                LOG.debugv("Discarding role snapshot of {0} loaded before a write", clientId);
                snapshots.invalidate(clientId);
            }
        });
    }

    private AtomicLong generation(String clientId) {
        return generations.computeIfAbsent(clientId, k -> new AtomicLong());
    }

    private Uni<Role> mutate(String clientId, String roleName, UnaryOperator<Role> change) {
        return repository
                .update(clientId, roleName, change)
                .map(updated -> updated.orElseThrow(() -> new EntityNotFoundException("Role", clientId + "/" + roleName)))
                .invoke(role -> invalidate(clientId));
    }

    private void requireSingleDefault(Role role, List<Role> existing) {
        if (!role.defaultRole()) {
            return;
        }
        existing.stream()
                .filter(r -> r.defaultRole() && !r.name().equals(role.name()))
                .findFirst()
                .ifPresent(other -> {
                    throw new EntityConflictException(
                            "Application " + role.clientId() + " already has default role " + other.name());
                });
    }

    private void validateRole(Role role, CapabilityGraph graph) {
        role.grants().forEach(grant -> validateGrant(grant, graph));
        role.rlsFilters().forEach(filter -> validateFilter(filter, graph));
    }

    /**
     * @throws IllegalArgumentException if a discovered graph has no such capability
     */
    private void validateGrant(Grant grant, CapabilityGraph graph) {
        if (graph == null) {
            LOG.warnv("Accepting grant {0} without a discovered capability graph", grant.render());
            return;
        }
        if (!PermissionResolver.matchesGraph(grant.target(), graph)) {
            throw new IllegalArgumentException("Grant " + grant.render() + " does not match any capability of "
                    + graph.clientId() + " (graph version " + graph.version() + ")");
        }
    }

    private void validateFilter(RlsFilter filter, CapabilityGraph graph) {
        if (graph != null && !graph.hasResource(filter.resource())) {
            throw new IllegalArgumentException("Row filter references unknown resource " + filter.resource());
        }
    }
}
