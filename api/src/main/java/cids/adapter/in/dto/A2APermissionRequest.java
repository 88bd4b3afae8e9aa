package cids.adapter.in.dto;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import jakarta.validation.constraints.NotBlank;

import cids.core.model.a2a.A2APermission;

/**
 * Permission for one application to obtain service tokens for another.
 *
 * @param maxTokenDurationSeconds ceiling on issued token lifetime, 300 when absent
 */
public record A2APermissionRequest(
        @NotBlank String sourceClientId,
        @NotBlank String targetClientId,
        Set<String> allowedScopes,
        Long maxTokenDurationSeconds,
        Boolean active,
        String description) {

    static final long DEFAULT_MAX_DURATION_SECONDS = 300;

    public A2APermission toPermission(String id, Instant createdAt) {
        return new A2APermission(
                id,
                sourceClientId,
                targetClientId,
                allowedScopes,
                Duration.ofSeconds(maxTokenDurationSeconds != null ? maxTokenDurationSeconds : DEFAULT_MAX_DURATION_SECONDS),
                active == null || active,
                description,
                createdAt,
                null);
    }
}
