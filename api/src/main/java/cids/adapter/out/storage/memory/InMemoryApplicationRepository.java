package cids.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import cids.core.model.app.Application;
import cids.core.port.out.ApplicationRepository;

/**
 * In-memory application registry. Data is lost on restart.
 */
public class InMemoryApplicationRepository implements ApplicationRepository {

    private final ConcurrentHashMap<String, Application> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Application> save(Application application) {
        return Uni.createFrom().item(() -> {
            storage.put(application.clientId(), application);
            return application;
        });
    }

    @Override
    public Uni<Optional<Application>> findById(String clientId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(clientId)));
    }

    @Override
    public Uni<List<Application>> findAll() {
        return Uni.createFrom().item(() -> storage.values().stream()
                .sorted(Comparator.comparing(Application::clientId))
                .toList());
    }
}
