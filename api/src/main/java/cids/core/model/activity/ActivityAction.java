package cids.core.model.activity;

/**
 * Audited events.
 */
public enum ActivityAction {
    TOKEN_ISSUED("token.issued"),
    TOKEN_REFRESHED("token.refreshed"),
    TOKEN_VALIDATED("token.validated"),
    TOKEN_REVOKED("token.revoked"),
    TOKEN_REFRESH_REUSE_DETECTED("token.refresh_reuse_detected"),
    A2A_TOKEN_ISSUED("a2a.token.issued"),
    A2A_TOKEN_DENIED("a2a.token.denied"),
    DISCOVERY_COMPLETED("discovery.completed");

    private final String value;

    ActivityAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
