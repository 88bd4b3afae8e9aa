package cids.core.service.permission;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import cids.core.model.capability.CapabilityGraph;
import cids.core.model.capability.FieldMetadata;
import cids.core.model.capability.SensitivityCategory;
import cids.core.model.permission.BasePermission;
import cids.core.model.permission.CategoryPermission;
import cids.core.model.permission.FieldPermission;
import cids.core.model.permission.Grant;
import cids.core.model.permission.Permission;
import cids.core.model.role.ResolvedPermissions;
import cids.core.model.role.RlsFilter;
import cids.core.model.role.Role;
import cids.core.model.role.RoleSnapshot;

/**
 * Computes the effective permissions of a principal from its group memberships.
 *
 * <p>Precedence rules, strongest first:
 * <ol>
 *   <li>A deny from any contributing role removes what it names, whatever the priority
 *       of the role that allowed it.</li>
 *   <li>Group-derived roles with a higher priority come before lower ones.</li>
 *   <li>Equal priorities keep declaration order. The default role comes last, and
 *       its row filters for a key are dropped when a group-derived role supplies
 *       filters for the same key.</li>
 * </ol>
 *
 * <p>This class does no I/O. Callers pass one consistent role snapshot and one
 * capability graph.
 */
public final class PermissionResolver {

    /**
     * Resolve permissions for a user principal.
     *
     * @param groups   the principal's group display names
     * @param snapshot roles and mappings of the target application
     * @param graph    the application's capability graph, or null if never discovered
     * @return the resolved permissions, empty when no role applies
     */
    public ResolvedPermissions resolve(Set<String> groups, RoleSnapshot snapshot, CapabilityGraph graph) {
        final var contributing = contributingRoles(groups != null ? groups : Set.of(), snapshot);
        if (contributing.isEmpty()) {
            return ResolvedPermissions.empty();
        }

        final var stale = new ArrayList<String>();
        final var access = new TreeMap<String, ActionAccess>();
        final var denies = new ArrayList<Permission>();

        for (var ranked : contributing) {
            for (var grant : ranked.role().grants()) {
                if (grant.isDeny()) {
                    denies.add(grant.target());
                    continue;
                }
                if (!expand(grant, graph, access)) {
                    stale.add(ranked.role().name() + ":" + grant.render());
                }
            }
        }

        for (var deny : denies) {
            applyDeny(deny, graph, access);
        }

        final var permissions = new TreeSet<String>();
        access.values().forEach(a -> permissions.addAll(a.render()));

        final var filters = collectFilters(contributing, access.keySet());

        return new ResolvedPermissions(
                List.copyOf(permissions),
                filters.expressions(),
                filters.operators(),
                contributing.stream().map(r -> r.role().name()).sorted().toList(),
                graph != null ? graph.version() : 0L,
                stale);
    }

    /**
     * Grants of the given roles that no longer match the capability graph.
     */
    public List<String> staleGrants(List<Role> roles, CapabilityGraph graph) {
        final var stale = new ArrayList<String>();
        for (var role : roles) {
            for (var grant : role.grants()) {
                if (!matchesGraph(grant.target(), graph)) {
                    stale.add(role.name() + ":" + grant.render());
                }
            }
        }
        return stale;
    }

    public static boolean matchesGraph(Permission permission, CapabilityGraph graph) {
        if (graph == null || !graph.hasAction(permission.resource(), permission.action())) {
            return false;
        }
        if (permission instanceof FieldPermission field) {
            return graph.fieldsFor(field.resource(), field.action()).containsKey(field.field());
        }
        return true;
    }

    private List<RankedRole> contributingRoles(Set<String> groups, RoleSnapshot snapshot) {
        final var eligible = new LinkedHashMap<String, RankedRole>();
        final var roles = snapshot.roles();
        for (int i = 0; i < roles.size(); i++) {
            final var role = roles.get(i);
            if (role.active() && !role.a2aOnly()) {
                eligible.put(role.name(), new RankedRole(role, i, false));
            }
        }

        final var mappedNames = new LinkedHashSet<String>();
        for (var mapping : snapshot.mappings()) {
            if (groups.contains(mapping.groupName())) {
                mappedNames.add(mapping.roleName());
            }
        }

        final var groupRoles = new ArrayList<RankedRole>();
        for (var name : mappedNames) {
            final var ranked = eligible.get(name);
            if (ranked != null) {
                groupRoles.add(ranked);
            }
        }
        groupRoles.sort(Comparator.comparingInt((RankedRole r) -> r.role().priority())
                .reversed()
                .thenComparingInt(RankedRole::declarationIndex));

        final var result = new ArrayList<>(groupRoles);
        for (var ranked : eligible.values()) {
            if (ranked.role().defaultRole() && !mappedNames.contains(ranked.role().name())) {
                result.add(new RankedRole(ranked.role(), ranked.declarationIndex(), true));
            }
        }
        return result;
    }

    private boolean expand(Grant grant, CapabilityGraph graph, Map<String, ActionAccess> access) {
        final var target = grant.target();
        if (!matchesGraph(target, graph)) {
            return false;
        }
        final var fields = graph.fieldsFor(target.resource(), target.action());
        final var entry = access.computeIfAbsent(
                target.base().render(), k -> new ActionAccess(target.resource(), target.action()));
        entry.includeCategory(SensitivityCategory.BASE, fields);

        if (target instanceof CategoryPermission category) {
            entry.includeCategory(category.category(), fields);
        } else if (target instanceof FieldPermission field) {
            entry.fields.add(field.field());
        }
        return true;
    }

    private void applyDeny(Permission deny, CapabilityGraph graph, Map<String, ActionAccess> access) {
        final var key = deny.base().render();
        final var entry = access.get(key);
        if (entry == null) {
            return;
        }
        if (deny instanceof BasePermission) {
            access.remove(key);
        } else if (deny instanceof CategoryPermission category) {
            if (category.isWildcard()) {
                access.remove(key);
                return;
            }
            entry.blocked.add(category.category());
            graph.fieldsFor(deny.resource(), deny.action()).values().stream()
                    .filter(f -> f.hasCategory(category.category()))
                    .forEach(f -> entry.fields.remove(f.name()));
        } else if (deny instanceof FieldPermission field) {
            entry.fields.remove(field.field());
            graph.field(field.resource(), field.field())
                    .map(FieldMetadata::category)
                    .ifPresent(entry.blocked::add);
        }
    }

    private FilterSet collectFilters(List<RankedRole> contributing, Set<String> grantedKeys) {
        final var groupKeys = new HashSet<String>();
        final var collected = new ArrayList<RankedFilter>();
        for (int rank = 0; rank < contributing.size(); rank++) {
            final var ranked = contributing.get(rank);
            for (var filter : ranked.role().rlsFilters()) {
                if (!grantedKeys.contains(filter.key())) {
                    continue;
                }
                if (!ranked.isDefault()) {
                    groupKeys.add(filter.key());
                } else if (groupKeys.contains(filter.key())) {
                    continue;
                }
                collected.add(new RankedFilter(filter, rank));
            }
        }
        collected.sort(Comparator.comparingInt(RankedFilter::rank)
                .thenComparing(Comparator.comparingInt((RankedFilter f) -> f.filter().priority())
                        .reversed()));

        final var expressions = new TreeMap<String, List<String>>();
        final var operators = new TreeMap<String, List<String>>();
        final var seen = new HashMap<String, Set<String>>();
        for (var ranked : collected) {
            final var filter = ranked.filter();
            final var signature = filter.operator() + " " + filter.expression();
            if (!seen.computeIfAbsent(filter.key(), k -> new HashSet<>()).add(signature)) {
                continue;
            }
            expressions.computeIfAbsent(filter.key(), k -> new ArrayList<>()).add(filter.expression());
            operators.computeIfAbsent(filter.key(), k -> new ArrayList<>()).add(filter.operator().name());
        }
        return new FilterSet(expressions, operators);
    }

    private record RankedRole(Role role, int declarationIndex, boolean isDefault) {}

    private record RankedFilter(RlsFilter filter, int rank) {}

    private record FilterSet(Map<String, List<String>> expressions, Map<String, List<String>> operators) {}

    private static final class ActionAccess {
        private final String resource;
        private final String action;
        private final EnumSet<SensitivityCategory> categories = EnumSet.noneOf(SensitivityCategory.class);
        private final EnumSet<SensitivityCategory> blocked = EnumSet.noneOf(SensitivityCategory.class);
        private final Set<String> fields = new LinkedHashSet<>();

        private ActionAccess(String resource, String action) {
            this.resource = resource;
            this.action = action;
        }

        void includeCategory(SensitivityCategory category, Map<String, FieldMetadata> available) {
            if (category.isWildcard()) {
                available.values().forEach(f -> {
                    fields.add(f.name());
                    if (f.category() != null) {
                        categories.add(f.category());
                    }
                });
                return;
            }
            categories.add(category);
            available.values().stream()
                    .filter(f -> f.hasCategory(category))
                    .forEach(f -> fields.add(f.name()));
        }

        List<String> render() {
            final var rendered = new ArrayList<String>();
            rendered.add(Permission.base(resource, action).render());
            for (var category : categories) {
                if (!blocked.contains(category)) {
                    rendered.add(Permission.category(resource, action, category).render());
                }
            }
            for (var field : fields) {
                rendered.add(Permission.field(resource, action, field).render());
            }
            return rendered;
        }
    }
}
