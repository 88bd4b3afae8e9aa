package cids.core.service.key;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.config.KeyRotationConfig;
import cids.core.model.key.KeyStatus;
import cids.core.model.key.SigningKey;
import cids.spi.SigningKeyRepository;

/**
 * Drives signing keys through their lifecycle.
 *
 * <ol>
 *   <li>Scheduled rotation stores a new PENDING key, published in the JWKS right away.</li>
 *   <li>After the pending grace period it is activated and the previous key is deprecated.</li>
 *   <li>Deprecated keys keep verifying for the deprecation period, then retire.</li>
 *   <li>Retired keys are deleted after the retention period.</li>
 * </ol>
 *
 * <p>Manual rotation skips the pending stage.
 */
@ApplicationScoped
public class KeyRotationService {

    private static final Logger LOG = Logger.getLogger(KeyRotationService.class);

    private final SigningKeyRegistry registry;
    private final SigningKeyRepository repository;
    private final KeyRotationConfig config;

    @Inject
    public KeyRotationService(SigningKeyRegistry registry, SigningKeyRepository repository, KeyRotationConfig config) {
        this.registry = registry;
        this.repository = repository;
        this.config = config;
    }

    @Scheduled(
            cron = "${cids.auth.key-rotation.schedule:0 0 0 1 * ?}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> rotateKeys() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        LOG.info("Starting scheduled key rotation...");
        return registry.generatePendingKey()
                .flatMap(key -> config.gracePeriod().isZero() || config.gracePeriod().isNegative()
                        ? registry.activateKey(key.keyId()).replaceWith(key)
                        : Uni.createFrom().item(key))
                .invoke(key -> LOG.infov("Key rotation completed: new key {0}", key.keyId()))
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Key rotation failed", e));
    }

    /**
     * Generate a key and activate it immediately. The current key enters its grace window.
     *
     * @param reason logged with the rotation
     * @return the new active key
     */
    public Uni<SigningKey> triggerRotation(String reason) {
        LOG.warnv("Manual key rotation triggered: {0}", reason != null ? reason : "no reason provided");
        return registry.generatePendingKey()
                .flatMap(key -> registry.activateKey(key.keyId()).replaceWith(key.keyId()))
                .flatMap(this::getKey)
                .invoke(key -> LOG.infov("Manual rotation completed: new active key {0}", key.keyId()));
    }

    @Scheduled(
            every = "${cids.auth.key-rotation.lifecycle-interval:15m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> scheduledLifecycle() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        return processKeyLifecycle();
    }

    /**
     * Activate due pending keys, retire deprecated keys past the grace window, and
     * delete retired keys past retention.
     */
    public Uni<Void> processKeyLifecycle() {
        LOG.debug("Processing key lifecycle transitions...");
        return activatePendingKeys()
                .flatMap(v -> retireDeprecatedKeys())
                .flatMap(v -> cleanupRetiredKeys())
                .onFailure()
                .invoke(e -> LOG.error("Key lifecycle processing failed", e));
    }

    public Uni<Void> cleanupRetiredKeys() {
        final var cutoff = Instant.now().minus(config.retentionPeriod());
        return repository.findByStatus(KeyStatus.RETIRED).flatMap(retired -> {
            final var toDelete = retired.stream()
                    .filter(key -> key.retiredAt() != null && key.retiredAt().isBefore(cutoff))
                    .toList();
            if (toDelete.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            LOG.infov("Deleting {0} retired keys past retention period", toDelete.size());
            return Uni.join()
                    .all(toDelete.stream().map(key -> repository.delete(key.keyId())).toList())
                    .andFailFast()
                    .replaceWithVoid();
        });
    }

    private Uni<Void> activatePendingKeys() {
        final var cutoff = Instant.now().minus(config.gracePeriod());
        return repository.findByStatus(KeyStatus.PENDING).flatMap(pending -> pending.stream()
                .filter(key -> !key.createdAt().isAfter(cutoff))
                .max(Comparator.comparing(SigningKey::createdAt))
                .map(key -> {
                    LOG.infov("Activating pending key {0} (past grace period)", key.keyId());
                    return registry.activateKey(key.keyId());
                })
                .orElse(Uni.createFrom().voidItem()));
    }

    private Uni<Void> retireDeprecatedKeys() {
        final var cutoff = Instant.now().minus(config.deprecationPeriod());
        return repository.findByStatus(KeyStatus.DEPRECATED).flatMap(deprecated -> {
            final var toRetire = deprecated.stream()
                    .filter(key -> key.deprecatedAt() != null && !key.deprecatedAt().isAfter(cutoff))
                    .toList();
            if (toRetire.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            LOG.infov("Retiring {0} deprecated keys past the grace window", toRetire.size());
            return Uni.join()
                    .all(toRetire.stream().map(key -> registry.retireKey(key.keyId())).toList())
                    .andFailFast()
                    .replaceWithVoid();
        });
    }

    public Uni<List<SigningKey>> listAllKeys() {
        return repository.findAll().map(keys -> keys.stream()
                .sorted(Comparator.comparing(SigningKey::createdAt).reversed())
                .map(SigningKey::withoutPrivateKey)
                .toList());
    }

    public Uni<SigningKey> getKey(String keyId) {
        return repository
                .findById(keyId)
                .map(opt -> opt.map(SigningKey::withoutPrivateKey)
                        .orElseThrow(() -> new KeyNotFoundException("Key not found: " + keyId)));
    }

    /**
     * Stop signing with a key while it keeps verifying.
     */
    public Uni<Void> forceDeprecate(String keyId) {
        return getKey(keyId).flatMap(key -> registry.deprecateKey(key.keyId()));
    }

    /**
     * Retire a key immediately. The active key cannot be retired, rotate first.
     */
    public Uni<Void> forceRetire(String keyId) {
        return getKey(keyId).flatMap(key -> {
            if (key.status() == KeyStatus.ACTIVE) {
                return Uni.createFrom()
                        .failure(new IllegalStateException("Cannot retire the active key, rotate first"));
            }
            return registry.retireKey(key.keyId());
        });
    }

    public static class KeyNotFoundException extends RuntimeException {
        public KeyNotFoundException(String message) {
            super(message);
        }
    }
}
