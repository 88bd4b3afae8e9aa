package cids.core.port.in;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import cids.core.model.permission.Grant;
import cids.core.model.role.GroupRoleMapping;
import cids.core.model.permission.PermissionCheck;
import cids.core.model.role.ResolvedPermissions;
import cids.core.model.role.RlsFilter;
import cids.core.model.role.Role;

/**
 * Use cases for roles, grants, row filters and group mappings.
 */
public interface RoleManagement {

    Uni<Role> createRole(Role role);

    /**
     * Replace an existing role, grants and filters included.
     */
    Uni<Role> updateRole(Role role);

    /**
     * Delete a role with its grants, filters and group mappings.
     */
    Uni<Boolean> deleteRole(String clientId, String roleName);

    Uni<Optional<Role>> getRole(String clientId, String roleName);

    Uni<List<Role>> listRoles(String clientId);

    Uni<Role> addGrant(String clientId, String roleName, Grant grant);

    Uni<Role> removeGrant(String clientId, String roleName, Grant grant);

    Uni<Role> addRlsFilter(String clientId, String roleName, RlsFilter filter);

    Uni<Role> removeRlsFilter(String clientId, String roleName, String filterId);

    Uni<GroupRoleMapping> mapGroup(GroupRoleMapping mapping);

    Uni<Boolean> unmapGroup(GroupRoleMapping mapping);

    Uni<List<GroupRoleMapping>> listMappings(String clientId);

    /**
     * Resolve the permissions a principal with the given groups would receive.
     */
    Uni<ResolvedPermissions> resolve(String clientId, Set<String> groups);

    /**
     * Check one permission string against what the given groups would resolve to.
     */
    Uni<PermissionCheck> check(String clientId, Set<String> groups, String permission);

    /**
     * Grants of the application that no longer match its capability graph.
     */
    Uni<List<String>> staleGrants(String clientId);
}
