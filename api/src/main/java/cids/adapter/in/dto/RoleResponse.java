package cids.adapter.in.dto;

import java.time.Instant;
import java.util.List;

import cids.core.model.permission.Grant;
import cids.core.model.role.RlsFilter;
import cids.core.model.role.Role;

public record RoleResponse(
        String clientId,
        String name,
        String description,
        boolean a2aOnly,
        boolean active,
        boolean defaultRole,
        int priority,
        List<String> grants,
        List<RlsFilter> rlsFilters,
        Instant createdAt,
        Instant updatedAt) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(
                role.clientId(),
                role.name(),
                role.description(),
                role.a2aOnly(),
                role.active(),
                role.defaultRole(),
                role.priority(),
                role.grants().stream().map(Grant::render).toList(),
                role.rlsFilters(),
                role.createdAt(),
                role.updatedAt());
    }
}
