package cids.core.model.role;

import java.util.List;

/**
 * Consistent view of an application's roles and group mappings, read together.
 */
public record RoleSnapshot(String clientId, List<Role> roles, List<GroupRoleMapping> mappings) {

    public RoleSnapshot {
        roles = roles != null ? List.copyOf(roles) : List.of();
        mappings = mappings != null ? List.copyOf(mappings) : List.of();
    }

    public static RoleSnapshot empty(String clientId) {
        return new RoleSnapshot(clientId, List.of(), List.of());
    }
}
