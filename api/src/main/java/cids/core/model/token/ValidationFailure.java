package cids.core.model.token;

/**
 * Why a presented credential was rejected.
 *
 * <p>401-class failures mean the credential itself is unusable. 403-class failures
 * mean the credential is genuine but presented in the wrong context.
 */
public enum ValidationFailure {
    MALFORMED(401),
    BAD_SIGNATURE(401),
    EXPIRED(401),
    NOT_YET_VALID(401),
    REVOKED(401),
    INVALID_API_KEY(401),
    WRONG_TOKEN_TYPE(401),
    WRONG_AUDIENCE(403),
    IP_MISMATCH(403),
    DEVICE_MISMATCH(403);

    private final int httpStatus;

    ValidationFailure(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean isContextual() {
        return httpStatus == 403;
    }
}
