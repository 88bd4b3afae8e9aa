package cids.adapter.out.auth;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.config.KeyRotationConfig;
import cids.core.model.key.KeyStatus;
import cids.core.model.key.SigningKey;
import cids.core.service.key.RsaKeys;
import cids.spi.SigningKeyRepository;

/**
 * Default signing key store.
 *
 * <p>Seeds the configured static key, if any, as the active key and keeps every
 * other key in memory. Keys generated at runtime are lost on restart.
 */
@ApplicationScoped
public class ConfigSigningKeyRepository implements SigningKeyRepository {

    private static final Logger LOG = Logger.getLogger(ConfigSigningKeyRepository.class);

    private final ConcurrentMap<String, SigningKey> keys = new ConcurrentHashMap<>();

    @Inject
    public ConfigSigningKeyRepository(KeyRotationConfig config) {
        config.staticKey().ifPresent(pem -> loadStaticKey(pem, config.staticKeyId()));
    }

    private void loadStaticKey(String pem, String keyId) {
        try {
            final var privateKey = RsaKeys.parsePrivateKey(pem);
            keys.put(keyId, SigningKey.active(keyId, privateKey, RsaKeys.derivePublicKey(privateKey), Instant.now()));
            LOG.infov("Loaded configured signing key: {0}", keyId);
        } catch (IllegalArgumentException e) {
            LOG.errorv(e, "Failed to load configured signing key {0}", keyId);
        }
    }

    @Override
    public Uni<Void> store(SigningKey key) {
        return Uni.createFrom().item(() -> {
            keys.put(key.keyId(), key);
            LOG.debugv("Stored signing key: {0} (status: {1})", key.keyId(), key.status());
            return null;
        });
    }

    @Override
    public Uni<Optional<SigningKey>> findById(String keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(keys.get(keyId)));
    }

    @Override
    public Uni<Optional<SigningKey>> findActive() {
        return Uni.createFrom().item(() -> keys.values().stream()
                .filter(key -> key.status() == KeyStatus.ACTIVE)
                .max(Comparator.comparing(key -> key.activatedAt() != null ? key.activatedAt() : key.createdAt())));
    }

    @Override
    public Uni<List<SigningKey>> findAllForVerification() {
        return Uni.createFrom().item(() ->
                keys.values().stream().filter(SigningKey::canVerify).toList());
    }

    @Override
    public Uni<List<SigningKey>> findByStatus(KeyStatus status) {
        return Uni.createFrom().item(() ->
                keys.values().stream().filter(key -> key.status() == status).toList());
    }

    @Override
    public Uni<Void> updateStatus(String keyId, KeyStatus newStatus, Instant transitionTime) {
        return Uni.createFrom().item(() -> {
            final var updated = keys.computeIfPresent(keyId, (id, existing) -> existing.status() == newStatus
                    ? existing
                    : existing.transitionTo(newStatus, transitionTime));
            if (updated == null) {
                throw new IllegalArgumentException("Key not found: " + keyId);
            }
            LOG.debugv("Updated key {0} status to {1}", keyId, newStatus);
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String keyId) {
        return Uni.createFrom().item(() -> {
            if (keys.remove(keyId) != null) {
                LOG.debugv("Deleted key: {0}", keyId);
            }
            return null;
        });
    }

    @Override
    public Uni<List<SigningKey>> findAll() {
        return Uni.createFrom().item(() -> List.copyOf(keys.values()));
    }
}
