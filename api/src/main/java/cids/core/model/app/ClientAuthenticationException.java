package cids.core.model.app;

/**
 * A client application failed to authenticate with its secret.
 */
public class ClientAuthenticationException extends RuntimeException {

    public ClientAuthenticationException(String message) {
        super(message);
    }
}
