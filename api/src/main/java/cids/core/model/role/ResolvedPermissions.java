package cids.core.model.role;

import java.util.List;
import java.util.Map;

/**
 * Result of resolving a principal's groups against an application.
 *
 * @param permissions     granted permission strings, sorted
 * @param rlsFilters      filter expressions keyed by {@code resource.action}
 * @param rlsOperators    operators aligned by index with {@link #rlsFilters}
 * @param roles           names of the roles that contributed, sorted
 * @param graphVersion    capability graph version used, 0 when none was discovered
 * @param staleReferences grants that no longer match the capability graph
 */
public record ResolvedPermissions(
        List<String> permissions,
        Map<String, List<String>> rlsFilters,
        Map<String, List<String>> rlsOperators,
        List<String> roles,
        long graphVersion,
        List<String> staleReferences) {

    public ResolvedPermissions {
        permissions = permissions != null ? List.copyOf(permissions) : List.of();
        rlsFilters = rlsFilters != null ? Map.copyOf(rlsFilters) : Map.of();
        rlsOperators = rlsOperators != null ? Map.copyOf(rlsOperators) : Map.of();
        roles = roles != null ? List.copyOf(roles) : List.of();
        staleReferences = staleReferences != null ? List.copyOf(staleReferences) : List.of();
    }

    public static ResolvedPermissions empty() {
        return new ResolvedPermissions(List.of(), Map.of(), Map.of(), List.of(), 0L, List.of());
    }

    public boolean isEmpty() {
        return permissions.isEmpty();
    }
}
