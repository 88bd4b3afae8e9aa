package cids.core.model.permission;

/**
 * Whether a grant adds or removes access.
 */
public enum GrantEffect {
    ALLOW,
    DENY
}
