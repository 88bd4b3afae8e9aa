package cids.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.app.Application;

/**
 * Use cases for the application registry.
 */
public interface ApplicationManagement {

    /**
     * Register a new application.
     *
     * @return the stored application, or a failure if the client ID is taken
     */
    Uni<Application> register(Application application);

    /**
     * Replace the mutable attributes of an existing application.
     */
    Uni<Application> update(Application application);

    /**
     * Soft-deactivate an application. It stays listed for audit purposes.
     */
    Uni<Application> deactivate(String clientId);

    Uni<Optional<Application>> get(String clientId);

    Uni<List<Application>> list();

    /**
     * Issue a new client secret, invalidating the previous one.
     *
     * @return the plaintext secret, shown once
     */
    Uni<String> rotateSecret(String clientId);

    /**
     * The application, failing if it is unknown or inactive.
     */
    Uni<Application> requireActive(String clientId);
}
