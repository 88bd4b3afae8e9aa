package cids.core.model.activity;

import java.time.Instant;
import java.util.Map;

import cids.core.model.token.TokenType;

/**
 * One append-only audit record.
 *
 * @param id        unique entry identifier
 * @param action    what happened
 * @param subject   principal involved, may be null
 * @param clientId  application involved, may be null
 * @param tokenType token kind, null when no token was involved
 * @param jti       token identifier, may be null
 * @param timestamp when it happened
 * @param details   extra attributes, never secrets
 */
public record ActivityEntry(
        String id,
        ActivityAction action,
        String subject,
        String clientId,
        TokenType tokenType,
        String jti,
        Instant timestamp,
        Map<String, String> details) {

    public ActivityEntry {
        details = details != null ? Map.copyOf(details) : Map.of();
    }
}
