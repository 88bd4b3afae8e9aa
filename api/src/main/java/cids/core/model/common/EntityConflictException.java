package cids.core.model.common;

/**
 * An entity with the same identity already exists.
 */
public class EntityConflictException extends RuntimeException {

    public EntityConflictException(String message) {
        super(message);
    }
}
