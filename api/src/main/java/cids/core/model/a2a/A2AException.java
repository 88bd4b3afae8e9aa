package cids.core.model.a2a;

import java.util.Set;

/**
 * Denial of a service token request. No token is issued when this is thrown.
 */
public class A2AException extends RuntimeException {

    private final A2AErrorType errorType;
    private final Set<String> deniedScopes;

    public A2AException(A2AErrorType errorType, String message) {
        this(errorType, message, Set.of());
    }

    public A2AException(A2AErrorType errorType, String message, Set<String> deniedScopes) {
        super(message);
        this.errorType = errorType;
        this.deniedScopes = deniedScopes != null ? Set.copyOf(deniedScopes) : Set.of();
    }

    public A2AErrorType errorType() {
        return errorType;
    }

    public Set<String> deniedScopes() {
        return deniedScopes;
    }
}
