package cids.adapter.in.auth;

/**
 * Permissions checked by the broker's own admin surface.
 */
public final class BrokerPermission {

    /** Full administration of applications, roles, keys and tokens. */
    public static final String ADMIN = "cids.admin";

    private BrokerPermission() {}
}
