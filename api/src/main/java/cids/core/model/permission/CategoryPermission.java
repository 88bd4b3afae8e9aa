package cids.core.model.permission;

import cids.core.model.capability.SensitivityCategory;

/**
 * Permission over every field of a sensitivity category, e.g. {@code employees.read.pii}.
 */
public record CategoryPermission(String resource, String action, SensitivityCategory category)
        implements Permission {

    public CategoryPermission {
        Permission.requireSegment(resource, "resource");
        Permission.requireSegment(action, "action");
        if (category == null) {
            throw new IllegalArgumentException("Category cannot be null");
        }
    }

    public boolean isWildcard() {
        return category.isWildcard();
    }

    @Override
    public String render() {
        return resource + DELIMITER + action + DELIMITER + category.label();
    }

    @Override
    public String toString() {
        return render();
    }
}
