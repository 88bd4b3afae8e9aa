package cids.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.app.ApiKey;

/**
 * Storage for application API keys, indexed by id and by key hash.
 */
public interface ApiKeyRepository {

    Uni<Void> save(ApiKey apiKey);

    Uni<Optional<ApiKey>> findById(String keyId);

    Uni<Optional<ApiKey>> findByHash(String keyHash);

    Uni<List<ApiKey>> findByClient(String clientId);

    /**
     * Remove keys that expired or whose rotation grace period ended.
     *
     * @return number of keys removed
     */
    Uni<Integer> deleteExpired(Instant now);
}
