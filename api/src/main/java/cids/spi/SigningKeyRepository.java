package cids.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.key.KeyStatus;
import cids.core.model.key.SigningKey;

/**
 * Storage for token signing keys.
 *
 * <p>Implementations must apply status transitions atomically and must never log
 * private key material. Alternative stores (an HSM, a secrets manager) are wired in
 * with CDI {@code @Alternative}.
 *
 * @see cids.adapter.out.auth.ConfigSigningKeyRepository
 */
public interface SigningKeyRepository {

    Uni<Void> store(SigningKey key);

    Uni<Optional<SigningKey>> findById(String keyId);

    /**
     * The key currently used for signing, the most recently activated one if several are ACTIVE.
     */
    Uni<Optional<SigningKey>> findActive();

    /**
     * ACTIVE and DEPRECATED keys, the set published in the JWKS.
     */
    Uni<List<SigningKey>> findAllForVerification();

    Uni<List<SigningKey>> findByStatus(KeyStatus status);

    /**
     * Move a key to a new status following the lifecycle.
     *
     * @throws IllegalStateException through the Uni if the transition is not allowed
     */
    Uni<Void> updateStatus(String keyId, KeyStatus newStatus, Instant transitionTime);

    Uni<Void> delete(String keyId);

    Uni<List<SigningKey>> findAll();
}
