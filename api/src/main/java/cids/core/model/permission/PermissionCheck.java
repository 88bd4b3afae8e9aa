package cids.core.model.permission;

import java.util.List;

/**
 * Whether a set of groups would be allowed a single permission string.
 *
 * @param permission   the requested permission string
 * @param granted      true when an exact, category or wildcard string covers it
 * @param roles        roles that contributed to the resolution
 * @param graphVersion capability graph version used, 0 when none was discovered
 */
public record PermissionCheck(String permission, boolean granted, List<String> roles, long graphVersion) {

    public PermissionCheck {
        roles = roles != null ? List.copyOf(roles) : List.of();
    }
}
