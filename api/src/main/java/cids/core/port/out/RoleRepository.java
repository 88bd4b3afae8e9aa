package cids.core.port.out;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import cids.core.model.role.GroupRoleMapping;
import cids.core.model.role.Role;
import cids.core.model.role.RoleSnapshot;

/**
 * Storage for roles, with their grants and filters, and group mappings.
 *
 * <p>Saving a role replaces it with its grants and filters in one step. Deleting a
 * role removes its grants, filters and group mappings.
 */
public interface RoleRepository {

    Uni<Role> save(Role role);

    Uni<Optional<Role>> findByName(String clientId, String roleName);

    /**
     * Apply a change to a stored role as one atomic step.
     *
     * @return the updated role, or empty if it does not exist
     * @throws IllegalArgumentException through the Uni if the change is rejected
     */
    Uni<Optional<Role>> update(String clientId, String roleName, UnaryOperator<Role> change);

    Uni<List<Role>> findByClient(String clientId);

    /**
     * @return true if the role existed
     */
    Uni<Boolean> delete(String clientId, String roleName);

    Uni<GroupRoleMapping> saveMapping(GroupRoleMapping mapping);

    /**
     * @return true if the mapping existed
     */
    Uni<Boolean> deleteMapping(GroupRoleMapping mapping);

    Uni<List<GroupRoleMapping>> findMappings(String clientId);

    /**
     * Roles and mappings of an application read as one consistent view.
     */
    Uni<RoleSnapshot> snapshot(String clientId);
}
