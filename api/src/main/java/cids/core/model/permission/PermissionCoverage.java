package cids.core.model.permission;

import java.util.Collection;
import java.util.Set;

import cids.core.model.capability.CapabilityGraph;
import cids.core.model.capability.SensitivityCategory;

/**
 * Decides whether a set of granted permission strings covers a requested permission.
 *
 * <p>An exact match always covers. A category string covers every field the graph
 * classifies with that category, and {@code resource.action.wildcard} covers every
 * field of the action. The base string {@code resource.action} covers the action
 * itself but no fields.
 */
public final class PermissionCoverage {

    private PermissionCoverage() {}

    public static boolean permits(Collection<String> granted, String requested, CapabilityGraph graph) {
        if (granted == null || granted.isEmpty() || requested == null) {
            return false;
        }
        final Set<String> grantedSet = granted instanceof Set<String> s ? s : Set.copyOf(granted);
        final Permission permission;
        try {
            permission = Permission.parseExternal(requested);
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (grantedSet.contains(permission.render())) {
            return true;
        }

        final var wildcard = Permission.category(permission.resource(), permission.action(), SensitivityCategory.WILDCARD)
                .render();
        if (permission instanceof FieldPermission field) {
            if (grantedSet.contains(wildcard)) {
                return true;
            }
            if (graph == null) {
                return false;
            }
            return graph.field(field.resource(), field.field())
                    .filter(metadata -> metadata.category() != null)
                    .map(metadata -> grantedSet.contains(
                            Permission.category(field.resource(), field.action(), metadata.category())
                                    .render()))
                    .orElse(false);
        }
        if (permission instanceof CategoryPermission category) {
            return !category.isWildcard() && grantedSet.contains(wildcard);
        }
        return false;
    }
}
