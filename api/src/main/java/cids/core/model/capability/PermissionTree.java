package cids.core.model.capability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import cids.core.model.permission.Permission;

/**
 * Browsable view of the permissions an application's capability graph makes grantable.
 *
 * @param clientId  owning application
 * @param version   graph version the tree was built from
 * @param resources resource name to its actions
 */
public record PermissionTree(String clientId, long version, Map<String, List<ActionNode>> resources) {

    /**
     * One grantable action with its category and field permissions.
     */
    public record ActionNode(
            String action, String permission, List<String> categories, Map<String, FieldNode> fields) {}

    /**
     * One field of a resource action.
     */
    public record FieldNode(String permission, String category, String type, String description) {}

    public static PermissionTree of(CapabilityGraph graph) {
        final var resources = new LinkedHashMap<String, List<ActionNode>>();
        for (var resource : graph.resources()) {
            final var actions = new ArrayList<ActionNode>();
            for (var action : graph.actions(resource)) {
                final var fieldNodes = new LinkedHashMap<String, FieldNode>();
                final var categories = new ArrayList<String>();
                categories.add(Permission.category(resource, action, SensitivityCategory.BASE).render());
                graph.fieldsFor(resource, action).forEach((name, field) -> {
                    if (field.isSensitive()) {
                        final var rendered = Permission.category(resource, action, field.category()).render();
                        if (!categories.contains(rendered)) {
                            categories.add(rendered);
                        }
                    }
                    fieldNodes.put(
                            name,
                            new FieldNode(
                                    Permission.field(resource, action, name).render(),
                                    field.category() != null ? field.category().label() : null,
                                    field.type(),
                                    field.description()));
                });
                actions.add(new ActionNode(
                        action, Permission.base(resource, action).render(), List.copyOf(categories), fieldNodes));
            }
            resources.put(resource, List.copyOf(actions));
        }
        return new PermissionTree(graph.clientId(), graph.version(), resources);
    }

    /**
     * Every permission string in the tree, optionally filtered by a case-insensitive substring.
     */
    public List<String> search(String query) {
        final var needle = query != null ? query.toLowerCase() : "";
        final var matches = new ArrayList<String>();
        resources.values().forEach(actions -> actions.forEach(node -> {
            addIfMatches(matches, node.permission(), needle);
            node.categories().forEach(c -> addIfMatches(matches, c, needle));
            node.fields().values().forEach(f -> addIfMatches(matches, f.permission(), needle));
        }));
        return matches;
    }

    /**
     * Permissions narrowed by resource and action, each null for any.
     *
     * @param sensitiveOnly keep only category permissions above base and fields classified above base
     */
    public List<String> search(String resource, String action, boolean sensitiveOnly) {
        final var matches = new ArrayList<String>();
        resources.forEach((name, actions) -> {
            if (resource != null && !resource.equals(name)) {
                return;
            }
            for (var node : actions) {
                if (action != null && !action.equals(node.action())) {
                    continue;
                }
                if (!sensitiveOnly) {
                    matches.add(node.permission());
                }
                node.categories().stream()
                        .filter(c -> !sensitiveOnly || !c.endsWith("." + SensitivityCategory.BASE.label()))
                        .forEach(matches::add);
                node.fields().values().stream()
                        .filter(f -> !sensitiveOnly
                                || (f.category() != null && !SensitivityCategory.BASE.label().equals(f.category())))
                        .forEach(f -> matches.add(f.permission()));
            }
        });
        return matches;
    }

    private static void addIfMatches(List<String> matches, String permission, String needle) {
        if (needle.isEmpty() || permission.toLowerCase().contains(needle)) {
            matches.add(permission);
        }
    }
}
