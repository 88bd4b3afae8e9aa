package cids.core.service.key;

import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.config.KeyRotationConfig;
import cids.core.model.key.KeyStatus;
import cids.core.model.key.SigningKey;
import cids.core.model.token.TokenIssuanceException;
import cids.spi.SigningKeyRepository;

/**
 * In-memory view of the signing keys, read on every issuance and validation.
 *
 * <p>The cache is one immutable {@link CacheState} behind a volatile reference, so
 * readers always see the active key and the verification set from the same refresh.
 * Every lifecycle change goes through the repository first and then refreshes the cache.
 */
@ApplicationScoped
public class SigningKeyRegistry {

    private static final Logger LOG = Logger.getLogger(SigningKeyRegistry.class);

    private final SigningKeyRepository repository;
    private final KeyRotationConfig config;

    private record CacheState(
            SigningKey activeKey, Map<String, SigningKey> verificationKeys, Instant lastRefresh) {

        static final CacheState EMPTY = new CacheState(null, Map.of(), null);
    }

    private volatile CacheState cache = CacheState.EMPTY;

    @Inject
    public SigningKeyRegistry(SigningKeyRepository repository, KeyRotationConfig config) {
        this.repository = repository;
        this.config = config;
    }

    void init(@Observes StartupEvent event) {
        LOG.info("Initializing signing key registry...");
        ensureActiveKey().await().atMost(Duration.ofSeconds(30));
        LOG.infov("Signing key registry ready, active key {0}", cache.activeKey().keyId());
    }

    /**
     * Make sure a key is active, generating one if the repository has none.
     */
    public Uni<Void> ensureActiveKey() {
        return repository.findActive().flatMap(active -> {
            if (active.isPresent()) {
                return refreshCache();
            }
            LOG.warn("No active signing key found, generating one");
            final var pair = RsaKeys.generate(config.keySize());
            final var key = SigningKey.active(
                    RsaKeys.newKeyId(),
                    (RSAPrivateKey) pair.getPrivate(),
                    (RSAPublicKey) pair.getPublic(),
                    Instant.now());
            return repository.store(key).flatMap(v -> refreshCache());
        });
    }

    /**
     * The key new tokens are signed with.
     *
     * @throws TokenIssuanceException if no key is active
     */
    public SigningKey getCurrentSigningKey() {
        final var key = cache.activeKey();
        if (key == null || !key.canSign()) {
            throw new TokenIssuanceException("No active signing key available");
        }
        return key;
    }

    public Optional<SigningKey> getVerificationKey(String keyId) {
        return Optional.ofNullable(cache.verificationKeys().get(keyId));
    }

    /**
     * ACTIVE and DEPRECATED keys, newest activation first.
     */
    public List<SigningKey> getVerificationKeys() {
        return List.copyOf(cache.verificationKeys().values());
    }

    public boolean isReady() {
        return cache.activeKey() != null;
    }

    public Optional<Instant> getLastRefreshTime() {
        return Optional.ofNullable(cache.lastRefresh());
    }

    /**
     * Generate a key and store it as PENDING. It is published but does not sign yet.
     */
    public Uni<SigningKey> generatePendingKey() {
        final var pair = RsaKeys.generate(config.keySize());
        final var key = SigningKey.pending(
                RsaKeys.newKeyId(), (RSAPrivateKey) pair.getPrivate(), (RSAPublicKey) pair.getPublic(), Instant.now());
        LOG.infov("Registering new signing key: {0}", key.keyId());
        return repository.store(key).replaceWith(key);
    }

    /**
     * Activate a pending key, deprecating the key it replaces.
     */
    public Uni<Void> activateKey(String keyId) {
        LOG.infov("Activating key: {0}", keyId);
        final var now = Instant.now();
        return repository
                .findActive()
                .flatMap(current -> current.filter(k -> !k.keyId().equals(keyId))
                        .map(old -> repository.updateStatus(old.keyId(), KeyStatus.DEPRECATED, now))
                        .orElse(Uni.createFrom().voidItem()))
                .flatMap(v -> repository.updateStatus(keyId, KeyStatus.ACTIVE, now))
                .invoke(() -> LOG.infov("Key {0} activated", keyId))
                .flatMap(v -> refreshCache());
    }

    public Uni<Void> deprecateKey(String keyId) {
        LOG.infov("Deprecating key: {0}", keyId);
        return repository
                .updateStatus(keyId, KeyStatus.DEPRECATED, Instant.now())
                .flatMap(v -> refreshCache());
    }

    /**
     * Retire a key. Tokens signed with it stop validating immediately.
     */
    public Uni<Void> retireKey(String keyId) {
        LOG.warnv("Retiring key: {0} - tokens signed with this key will no longer validate", keyId);
        return repository
                .updateStatus(keyId, KeyStatus.RETIRED, Instant.now())
                .flatMap(v -> refreshCache());
    }

    /**
     * Reload the cache from the repository. On failure the previous cache stays in use.
     */
    @Scheduled(
            every = "${cids.auth.key-rotation.cache-refresh-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> refreshCache() {
        return Uni.combine()
                .all()
                .unis(repository.findActive(), repository.findAllForVerification())
                .asTuple()
                .invoke(tuple -> {
                    final var active = tuple.getItem1().orElse(null);
                    final var verification = new LinkedHashMap<String, SigningKey>();
                    tuple.getItem2().stream()
                            .filter(SigningKey::canVerify)
                            .sorted((a, b) -> activation(b).compareTo(activation(a)))
                            .forEach(k -> verification.put(k.keyId(), k.withoutPrivateKey()));

                    this.cache = new CacheState(active, Collections.unmodifiableMap(verification), Instant.now());

                    LOG.debugv(
                            "Signing key cache refreshed: active={0}, verification keys={1}",
                            active != null ? active.keyId() : "none", verification.size());
                })
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Failed to refresh signing key cache", e));
    }

    private static Instant activation(SigningKey key) {
        return key.activatedAt() != null ? key.activatedAt() : key.createdAt();
    }
}
