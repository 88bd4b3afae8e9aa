package cids.core.port.in;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.app.ApiKey;
import cids.core.model.app.ApiKeyCreateResult;

/**
 * Use cases for application API keys.
 */
public interface ApiKeyManagement {

    /**
     * Create a key for an application.
     *
     * @param ttl       lifetime, null for a key that does not expire
     * @param createdBy principal creating the key
     */
    Uni<ApiKeyCreateResult> create(String clientId, String name, Duration ttl, String createdBy);

    /**
     * Keys of an application with their hashes redacted.
     */
    Uni<List<ApiKey>> list(String clientId);

    /**
     * @return true if the key existed and belonged to the application
     */
    Uni<Boolean> revoke(String clientId, String keyId);

    /**
     * Replace a key. The old key keeps working for the rotation grace period.
     */
    Uni<ApiKeyCreateResult> rotate(String clientId, String keyId, String createdBy);

    /**
     * The stored key for a plaintext, if it is currently usable.
     */
    Uni<Optional<ApiKey>> validate(String plaintextKey);
}
