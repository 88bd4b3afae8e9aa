package cids.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import cids.core.model.app.Application;

/**
 * Storage for registered applications. Applications are never deleted.
 */
public interface ApplicationRepository {

    Uni<Application> save(Application application);

    Uni<Optional<Application>> findById(String clientId);

    Uni<List<Application>> findAll();
}
