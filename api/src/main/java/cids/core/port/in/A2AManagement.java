package cids.core.port.in;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import cids.core.model.a2a.A2APermission;
import cids.core.model.a2a.ServiceTokenGrant;

/**
 * Use cases for application-to-application access.
 */
public interface A2AManagement {

    /**
     * Issue a service token to the application owning {@code apiKey}.
     *
     * <p>Fails with {@link cids.core.model.a2a.A2AException} when the key is invalid,
     * no active permission exists, or any requested scope is not allowed.
     *
     * @param requestedScopes scopes to carry, all allowed scopes when empty
     * @param duration        requested lifetime, null for the default
     */
    Uni<ServiceTokenGrant> requestServiceToken(
            String apiKey, String targetClientId, Set<String> requestedScopes, Duration duration);

    Uni<A2APermission> savePermission(A2APermission permission);

    Uni<A2APermission> setActive(String id, boolean active);

    Uni<Optional<A2APermission>> getPermission(String id);

    Uni<List<A2APermission>> listPermissions();

    Uni<Boolean> deletePermission(String id);
}
