package cids.core.model.permission;

/**
 * A permission assigned to a role, either allowing or denying it.
 *
 * <p>Denials always take precedence over allows during resolution, whichever role
 * they come from.
 */
public record Grant(Permission target, GrantEffect effect) {

    public Grant {
        if (target == null) {
            throw new IllegalArgumentException("Grant target cannot be null");
        }
        if (effect == null) {
            effect = GrantEffect.ALLOW;
        }
    }

    public static Grant allow(String permission) {
        return new Grant(Permission.parseExternal(permission), GrantEffect.ALLOW);
    }

    public static Grant deny(String permission) {
        return new Grant(Permission.parseExternal(permission), GrantEffect.DENY);
    }

    public boolean isDeny() {
        return effect == GrantEffect.DENY;
    }

    /**
     * Rendered form, prefixed with {@code !} for denials.
     */
    public String render() {
        return isDeny() ? "!" + target.render() : target.render();
    }

    /**
     * Parse the rendered form produced by {@link #render()}.
     */
    public static Grant parse(String value) {
        if (value != null && value.startsWith("!")) {
            return deny(value.substring(1));
        }
        return allow(value);
    }
}
