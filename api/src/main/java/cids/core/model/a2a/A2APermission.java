package cids.core.model.a2a;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Allows a source application to obtain service tokens for a target application.
 *
 * @param id               identifier
 * @param sourceClientId   calling application
 * @param targetClientId   application the tokens are issued for
 * @param allowedScopes    scopes the source may request
 * @param maxTokenDuration upper bound on issued token lifetime
 * @param active           inactive entries deny like missing ones
 * @param description      free text
 * @param createdAt        creation time
 * @param updatedAt        last modification time
 */
public record A2APermission(
        String id,
        String sourceClientId,
        String targetClientId,
        Set<String> allowedScopes,
        Duration maxTokenDuration,
        boolean active,
        String description,
        Instant createdAt,
        Instant updatedAt) {

    public A2APermission {
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        if (sourceClientId == null || sourceClientId.isBlank()) {
            throw new IllegalArgumentException("Source client ID cannot be null or blank");
        }
        if (targetClientId == null || targetClientId.isBlank()) {
            throw new IllegalArgumentException("Target client ID cannot be null or blank");
        }
        if (sourceClientId.equals(targetClientId)) {
            throw new IllegalArgumentException("Source and target must differ");
        }
        allowedScopes = allowedScopes != null ? Set.copyOf(allowedScopes) : Set.of();
        if (maxTokenDuration == null || maxTokenDuration.isNegative() || maxTokenDuration.isZero()) {
            throw new IllegalArgumentException("Max token duration must be positive");
        }
        if (description == null) {
            description = "";
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public A2APermission withActive(boolean value) {
        return new A2APermission(
                id, sourceClientId, targetClientId, allowedScopes, maxTokenDuration, value, description, createdAt,
                Instant.now());
    }
}
