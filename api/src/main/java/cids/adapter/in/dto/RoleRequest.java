package cids.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;

import cids.core.model.permission.Grant;
import cids.core.model.role.Role;

/**
 * Role creation or replacement.
 *
 * @param grants permission strings, a leading {@code !} marks a deny. Both {@code .}
 *               and {@code :} are accepted as separators
 */
public record RoleRequest(
        @NotBlank String name,
        String description,
        boolean a2aOnly,
        Boolean active,
        boolean defaultRole,
        int priority,
        List<String> grants) {

    public Role toRole(String clientId) {
        return Role.builder(clientId, name)
                .description(description)
                .a2aOnly(a2aOnly)
                .active(active == null || active)
                .defaultRole(defaultRole)
                .priority(priority)
                .grants(grants == null ? List.of() : grants.stream().map(Grant::parse).toList())
                .build();
    }
}
