package cids.core.model.a2a;

/**
 * Why a service token request was denied.
 */
public enum A2AErrorType {
    INVALID_API_KEY(401),
    NO_PERMISSION(403),
    SCOPE_DENIED(403),
    TARGET_INACTIVE(403);

    private final int httpStatus;

    A2AErrorType(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
