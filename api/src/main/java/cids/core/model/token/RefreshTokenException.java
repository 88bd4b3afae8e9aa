package cids.core.model.token;

/**
 * A refresh token could not be exchanged.
 */
public class RefreshTokenException extends RuntimeException {

    public enum Reason {
        REFRESH_INVALID,
        REFRESH_EXPIRED,
        REFRESH_REUSED
    }

    private final Reason reason;

    public RefreshTokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
