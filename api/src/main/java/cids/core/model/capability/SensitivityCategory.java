package cids.core.model.capability;

import java.util.Locale;
import java.util.Optional;

/**
 * Sensitivity classification for response fields.
 *
 * <p>{@link #WILDCARD} is only meaningful inside a grant, where it selects every
 * field of a resource action regardless of classification. Fields themselves are
 * never classified as wildcard.
 */
public enum SensitivityCategory {
    BASE("base"),
    PII("pii"),
    PHI("phi"),
    FINANCIAL("financial"),
    SENSITIVE("sensitive"),
    WILDCARD("wildcard");

    private final String label;

    SensitivityCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isWildcard() {
        return this == WILDCARD;
    }

    /**
     * Look up a category by its label.
     *
     * <p>Matching is case-insensitive and {@code *} is accepted as an alias of
     * {@link #WILDCARD}.
     *
     * @param label the label to look up
     * @return the category, or empty if the label is not a category
     */
    public static Optional<SensitivityCategory> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        if ("*".equals(label)) {
            return Optional.of(WILDCARD);
        }
        final var normalized = label.trim().toLowerCase(Locale.ROOT);
        for (var category : values()) {
            if (category.label.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the given label names a category, including the wildcard alias.
     */
    public static boolean isCategoryLabel(String label) {
        return fromLabel(label).isPresent();
    }
}
