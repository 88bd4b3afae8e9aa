package cids.core.model.key;

import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.Objects;

/**
 * RSA signing key and its lifecycle timestamps.
 *
 * @param keyId        JWT {@code kid}
 * @param privateKey   signing half, null for verification-only copies
 * @param publicKey    verification half published in the JWKS
 * @param status       lifecycle status
 * @param createdAt    creation time
 * @param activatedAt  when the key started signing
 * @param deprecatedAt when the key stopped signing
 * @param retiredAt    when the key stopped verifying
 */
public record SigningKey(
        String keyId,
        RSAPrivateKey privateKey,
        RSAPublicKey publicKey,
        KeyStatus status,
        Instant createdAt,
        Instant activatedAt,
        Instant deprecatedAt,
        Instant retiredAt) {

    public SigningKey {
        Objects.requireNonNull(keyId, "keyId is required");
        Objects.requireNonNull(publicKey, "publicKey is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public static SigningKey pending(String keyId, RSAPrivateKey privateKey, RSAPublicKey publicKey, Instant now) {
        return new SigningKey(keyId, privateKey, publicKey, KeyStatus.PENDING, now, null, null, null);
    }

    public static SigningKey active(String keyId, RSAPrivateKey privateKey, RSAPublicKey publicKey, Instant now) {
        return new SigningKey(keyId, privateKey, publicKey, KeyStatus.ACTIVE, now, now, null, null);
    }

    /**
     * Move this key to the given status.
     *
     * @throws IllegalStateException if the lifecycle does not allow the transition
     */
    public SigningKey transitionTo(KeyStatus target, Instant at) {
        final var when = at != null ? at : Instant.now();
        return switch (target) {
            case PENDING -> throw new IllegalStateException("Keys cannot return to PENDING");
            case ACTIVE -> {
                requireStatus(target, KeyStatus.PENDING);
                yield new SigningKey(keyId, privateKey, publicKey, target, createdAt, when, null, null);
            }
            case DEPRECATED -> {
                requireStatus(target, KeyStatus.ACTIVE);
                yield new SigningKey(keyId, privateKey, publicKey, target, createdAt, activatedAt, when, null);
            }
            case RETIRED -> {
                if (status == KeyStatus.RETIRED) {
                    throw new IllegalStateException("Key " + keyId + " is already RETIRED");
                }
                yield new SigningKey(
                        keyId,
                        privateKey,
                        publicKey,
                        target,
                        createdAt,
                        activatedAt,
                        deprecatedAt != null ? deprecatedAt : when,
                        when);
            }
        };
    }

    public boolean canSign() {
        return privateKey != null && status == KeyStatus.ACTIVE;
    }

    public boolean canVerify() {
        return status.isPublished();
    }

    public SigningKey withoutPrivateKey() {
        return new SigningKey(keyId, null, publicKey, status, createdAt, activatedAt, deprecatedAt, retiredAt);
    }

    private void requireStatus(KeyStatus target, KeyStatus required) {
        if (status != required) {
            throw new IllegalStateException(
                    "Cannot move key " + keyId + " from " + status + " to " + target);
        }
    }
}
