package cids.core.model.permission;

import java.util.regex.Pattern;

import cids.core.model.capability.SensitivityCategory;

/**
 * A hierarchical permission in the canonical {@code resource.action[.qualifier]} format.
 *
 * <p>The qualifier is interpreted as a sensitivity category when it matches a
 * category label (or {@code *}) and as a field name otherwise. Field names may
 * themselves contain dots for nested fields.
 *
 * <p>{@code :} is accepted as a delimiter only at system boundaries via
 * {@link #parseExternal(String)}; internally everything is rendered with {@code .}.
 */
public sealed interface Permission permits BasePermission, CategoryPermission, FieldPermission {

    char DELIMITER = '.';
    char EXTERNAL_DELIMITER = ':';

    Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_\\-]+");
    Pattern FIELD = Pattern.compile("[A-Za-z0-9_\\-]+(\\.[A-Za-z0-9_\\-]+)*");

    String resource();

    String action();

    /**
     * Canonical string form.
     */
    String render();

    /**
     * The {@code resource.action} permission this permission qualifies.
     */
    default BasePermission base() {
        return new BasePermission(resource(), action());
    }

    default boolean sameAction(Permission other) {
        return resource().equals(other.resource()) && action().equals(other.action());
    }

    static BasePermission base(String resource, String action) {
        return new BasePermission(resource, action);
    }

    static CategoryPermission category(String resource, String action, SensitivityCategory category) {
        return new CategoryPermission(resource, action, category);
    }

    static FieldPermission field(String resource, String action, String field) {
        return new FieldPermission(resource, action, field);
    }

    /**
     * Parse a permission in canonical dot-delimited form.
     *
     * @param value the permission string
     * @return the parsed permission
     * @throws IllegalArgumentException if the string is not a valid permission
     */
    static Permission parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Permission cannot be null or blank");
        }
        final var parts = value.trim().split("\\.", 3);
        if (parts.length < 2) {
            throw new IllegalArgumentException("Permission must have at least resource and action: " + value);
        }
        if (parts.length == 2) {
            return new BasePermission(parts[0], parts[1]);
        }
        final var qualifier = parts[2];
        return SensitivityCategory.fromLabel(qualifier)
                .<Permission>map(category -> new CategoryPermission(parts[0], parts[1], category))
                .orElseGet(() -> new FieldPermission(parts[0], parts[1], qualifier));
    }

    /**
     * Parse a permission that may use {@code :} as its delimiter.
     */
    static Permission parseExternal(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Permission cannot be null or blank");
        }
        return parse(value.replace(EXTERNAL_DELIMITER, DELIMITER));
    }

    static void requireSegment(String segment, String name) {
        if (segment == null || !SEGMENT.matcher(segment).matches()) {
            throw new IllegalArgumentException("Invalid permission " + name + ": " + segment);
        }
    }
}
