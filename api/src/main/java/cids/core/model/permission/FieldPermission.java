package cids.core.model.permission;

import cids.core.model.capability.SensitivityCategory;

/**
 * Permission over a single named field, e.g. {@code employees.read.salary}.
 */
public record FieldPermission(String resource, String action, String field) implements Permission {

    public FieldPermission {
        Permission.requireSegment(resource, "resource");
        Permission.requireSegment(action, "action");
        if (field == null || !FIELD.matcher(field).matches()) {
            throw new IllegalArgumentException("Invalid permission field: " + field);
        }
        if (SensitivityCategory.isCategoryLabel(field)) {
            throw new IllegalArgumentException("Field name collides with a category label: " + field);
        }
    }

    @Override
    public String render() {
        return resource + DELIMITER + action + DELIMITER + field;
    }

    @Override
    public String toString() {
        return render();
    }
}
