package cids.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import cids.core.model.app.ApiKey;
import cids.core.port.out.ApiKeyRepository;

/**
 * In-memory API key storage with a secondary index on the key hash.
 */
public class InMemoryApiKeyRepository implements ApiKeyRepository {

    private final ConcurrentHashMap<String, ApiKey> byId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> idByHash = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(ApiKey apiKey) {
        return Uni.createFrom().item(() -> {
            byId.put(apiKey.id(), apiKey);
            idByHash.put(apiKey.keyHash(), apiKey.id());
            return null;
        });
    }

    @Override
    public Uni<Optional<ApiKey>> findById(String keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(byId.get(keyId)));
    }

    @Override
    public Uni<Optional<ApiKey>> findByHash(String keyHash) {
        return Uni.createFrom().item(() -> Optional.ofNullable(idByHash.get(keyHash)).map(byId::get));
    }

    @Override
    public Uni<List<ApiKey>> findByClient(String clientId) {
        return Uni.createFrom().item(() -> byId.values().stream()
                .filter(k -> k.clientId().equals(clientId))
                .sorted(Comparator.comparing(ApiKey::createdAt))
                .toList());
    }

    @Override
    public Uni<Integer> deleteExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            int removed = 0;
            for (var key : List.copyOf(byId.values())) {
                if (key.isExpired(now) && byId.remove(key.id(), key)) {
                    idByHash.remove(key.keyHash());
                    removed++;
                }
            }
            return removed;
        });
    }
}
