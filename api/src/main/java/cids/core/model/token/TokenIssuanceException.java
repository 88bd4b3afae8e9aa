package cids.core.model.token;

/**
 * A token could not be produced, usually because no signing key is usable.
 */
public class TokenIssuanceException extends RuntimeException {

    public TokenIssuanceException(String message) {
        super(message);
    }

    public TokenIssuanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
