package cids.core.model.role;

/**
 * How a row filter combines with the other filters on the same resource action.
 */
public enum FilterOperator {
    AND,
    OR
}
