package cids.core.model.capability;

/**
 * Metadata for a single response field discovered from an application.
 *
 * @param name        field name, unique within its resource
 * @param type        declared data type (string, integer, ...)
 * @param category    sensitivity category, or null when the field is unclassified
 * @param nullable    whether the field may be null
 * @param description human-readable description
 * @param searchable  whether the field can be searched on
 * @param filterable  whether the field can be used in row filters
 * @param maxLength   maximum length for string fields, if declared
 * @param format      format hint such as {@code email} or {@code date}
 */
public record FieldMetadata(
        String name,
        String type,
        SensitivityCategory category,
        boolean nullable,
        String description,
        boolean searchable,
        boolean filterable,
        Integer maxLength,
        String format) {

    public FieldMetadata {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be null or blank");
        }
        if (category == SensitivityCategory.WILDCARD) {
            throw new IllegalArgumentException("Field '" + name + "' cannot be classified as wildcard");
        }
        if (type == null || type.isBlank()) {
            type = "string";
        }
        if (description == null) {
            description = "";
        }
    }

    public static FieldMetadata of(String name, SensitivityCategory category) {
        return new FieldMetadata(name, "string", category, true, "", false, false, null, null);
    }

    public boolean isClassified() {
        return category != null;
    }

    public boolean isSensitive() {
        return category != null && category != SensitivityCategory.BASE;
    }

    public boolean hasCategory(SensitivityCategory candidate) {
        return category != null && category == candidate;
    }
}
