package cids.core.model.discovery;

/**
 * Outcome of a discovery run.
 */
public enum DiscoveryStatus {
    /** Graph replaced with no warnings. */
    SUCCESS,
    /** Graph replaced, but existing grants reference capabilities that disappeared. */
    PARTIAL,
    /** Nothing replaced. */
    ERROR,
    /** A recent successful discovery was reused. */
    CACHED
}
