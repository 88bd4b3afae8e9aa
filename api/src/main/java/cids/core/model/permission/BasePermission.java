package cids.core.model.permission;

/**
 * Permission to perform an action on a resource, e.g. {@code employees.read}.
 */
public record BasePermission(String resource, String action) implements Permission {

    public BasePermission {
        Permission.requireSegment(resource, "resource");
        Permission.requireSegment(action, "action");
    }

    @Override
    public String render() {
        return resource + DELIMITER + action;
    }

    @Override
    public String toString() {
        return render();
    }
}
