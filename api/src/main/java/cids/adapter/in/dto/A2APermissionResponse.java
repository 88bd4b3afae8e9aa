package cids.adapter.in.dto;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

import cids.core.model.a2a.A2APermission;

public record A2APermissionResponse(
        String id,
        String sourceClientId,
        String targetClientId,
        Set<String> allowedScopes,
        long maxTokenDurationSeconds,
        boolean active,
        String description,
        Instant createdAt,
        Instant updatedAt) {

    public static A2APermissionResponse from(A2APermission permission) {
        return new A2APermissionResponse(
                permission.id(),
                permission.sourceClientId(),
                permission.targetClientId(),
                new TreeSet<>(permission.allowedScopes()),
                permission.maxTokenDuration().toSeconds(),
                permission.active(),
                permission.description(),
                permission.createdAt(),
                permission.updatedAt());
    }
}
