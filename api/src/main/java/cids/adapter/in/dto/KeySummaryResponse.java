package cids.adapter.in.dto;

import java.time.Instant;

import cids.core.model.key.KeyStatus;
import cids.core.model.key.SigningKey;

/**
 * Signing key metadata. Key material is never returned.
 */
public record KeySummaryResponse(
        String keyId,
        KeyStatus status,
        Instant createdAt,
        Instant activatedAt,
        Instant deprecatedAt,
        Instant retiredAt) {

    public static KeySummaryResponse from(SigningKey key) {
        return new KeySummaryResponse(
                key.keyId(), key.status(), key.createdAt(), key.activatedAt(), key.deprecatedAt(), key.retiredAt());
    }
}
