package cids.core.service.app;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.config.ApiKeyConfig;
import cids.core.model.app.ApiKey;
import cids.core.model.app.ApiKeyCreateResult;
import cids.core.model.common.EntityNotFoundException;
import cids.core.port.in.ApiKeyManagement;
import cids.core.port.in.ApplicationManagement;
import cids.core.port.out.ApiKeyRepository;
import cids.core.service.common.SecureTokens;

/**
 * Application API keys.
 *
 * <p>Keys are stored as SHA-256 hashes; the plaintext is only returned once at
 * creation. A rotated key keeps working until its grace period ends.
 */
@ApplicationScoped
public class ApiKeyService implements ApiKeyManagement {

    private static final Logger LOG = Logger.getLogger(ApiKeyService.class);
    private static final int KEY_LENGTH_BYTES = 32;
    private static final int KEY_ID_LENGTH = 8;
    private static final int DISPLAY_PREFIX_LENGTH = 4;

    private final ApiKeyRepository repository;
    private final ApplicationManagement applications;
    private final ApiKeyConfig config;

    @Inject
    public ApiKeyService(ApiKeyRepository repository, ApplicationManagement applications, ApiKeyConfig config) {
        this.repository = repository;
        this.applications = applications;
        this.config = config;
    }

    @Override
    public Uni<ApiKeyCreateResult> create(String clientId, String name, Duration ttl, String createdBy) {
        validateTtl(ttl);
        return applications.requireActive(clientId).flatMap(app -> issue(app.clientId(), name, ttl, createdBy));
    }

    private Uni<ApiKeyCreateResult> issue(String clientId, String name, Duration ttl, String createdBy) {
        final var keyId = SecureTokens.randomHex(KEY_ID_LENGTH);
        final var plaintextKey = config.prefix() + SecureTokens.randomUrlSafe(KEY_LENGTH_BYTES);
        final var now = Instant.now();

        final var apiKey = new ApiKey(
                keyId,
                clientId,
                SecureTokens.sha256Hex(plaintextKey),
                plaintextKey.substring(0, config.prefix().length() + DISPLAY_PREFIX_LENGTH),
                name,
                createdBy,
                now,
                ttl != null ? now.plus(ttl) : null,
                false,
                null);

        LOG.infov("Created API key {0} for {1}", keyId, clientId);
        return repository.save(apiKey).replaceWith(new ApiKeyCreateResult(keyId, plaintextKey, apiKey.redacted()));
    }

    @Override
    public Uni<Optional<ApiKey>> validate(String plaintextKey) {
        if (plaintextKey == null || plaintextKey.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var now = Instant.now();
        return repository
                .findByHash(SecureTokens.sha256Hex(plaintextKey))
                .map(opt -> opt.filter(key -> key.isValid(now)));
    }

    @Override
    public Uni<List<ApiKey>> list(String clientId) {
        return repository.findByClient(clientId).map(keys -> keys.stream()
                .map(ApiKey::redacted)
                .toList());
    }

    @Override
    public Uni<Boolean> revoke(String clientId, String keyId) {
        return repository.findById(keyId).flatMap(existing -> {
            if (existing.isEmpty() || !existing.get().clientId().equals(clientId)) {
                return Uni.createFrom().item(false);
            }
            LOG.infov("Revoking API key {0} of {1}", keyId, clientId);
            return repository.save(existing.get().revoke()).replaceWith(true);
        });
    }

    @Override
    public Uni<ApiKeyCreateResult> rotate(String clientId, String keyId, String createdBy) {
        return repository.findById(keyId).flatMap(existing -> {
            final var old = existing.filter(key -> key.clientId().equals(clientId)
                            && key.isValid(Instant.now()))
                    .orElseThrow(() -> new EntityNotFoundException("API key", keyId));
            final var ttl = old.expiresAt() != null ? Duration.between(old.createdAt(), old.expiresAt()) : null;
            final var graceEnd = Instant.now().plus(config.rotationGracePeriod());
            LOG.infov("Rotating API key {0} of {1}, old key valid until {2}", keyId, clientId, graceEnd);
            return repository
                    .save(old.rotatedOut(graceEnd))
                    .flatMap(v -> issue(clientId, old.name(), ttl, createdBy));
        });
    }

    @Scheduled(every = "1h", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Integer> cleanupExpired() {
        return repository.deleteExpired(Instant.now()).invoke(removed -> {
            if (removed > 0) {
                LOG.infov("Deleted {0} expired API keys", removed);
            }
        });
    }

    /**
     * @throws IllegalArgumentException if the TTL exceeds the configured maximum
     */
    private void validateTtl(Duration ttl) {
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        config.maxTtl().ifPresent(maxTtl -> {
            if (ttl == null) {
                throw new IllegalArgumentException("TTL is required. Maximum allowed: " + maxTtl);
            }
            if (ttl.compareTo(maxTtl) > 0) {
                throw new IllegalArgumentException(
                        "TTL exceeds maximum allowed. Requested: " + ttl + ", Maximum: " + maxTtl);
            }
        });
    }
}
