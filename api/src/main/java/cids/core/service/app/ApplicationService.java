package cids.core.service.app;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.model.app.Application;
import cids.core.model.common.EntityConflictException;
import cids.core.model.common.EntityNotFoundException;
import cids.core.port.in.ApplicationManagement;
import cids.core.port.out.ApplicationRepository;
import cids.core.service.common.SecureTokens;

/**
 * Registry of client applications.
 */
@ApplicationScoped
public class ApplicationService implements ApplicationManagement {

    private static final Logger LOG = Logger.getLogger(ApplicationService.class);
    private static final int CLIENT_SECRET_BYTES = 32;

    private final ApplicationRepository repository;

    @Inject
    public ApplicationService(ApplicationRepository repository) {
        this.repository = repository;
    }

    @Override
    public Uni<Application> register(Application application) {
        if (application.discoveryEndpoint() != null && !application.discoveryEndpoint().isBlank()) {
            application.discoveryUri();
        }
        return repository.findById(application.clientId()).flatMap(existing -> {
            if (existing.isPresent()) {
                return Uni.createFrom()
                        .failure(new EntityConflictException(
                                "Application already registered: " + application.clientId()));
            }
            final var now = Instant.now();
            LOG.infov("Registering application {0}", application.clientId());
            return repository.save(application.toBuilder()
                    .active(true)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        });
    }

    @Override
    public Uni<Application> update(Application application) {
        if (application.discoveryEndpoint() != null && !application.discoveryEndpoint().isBlank()) {
            application.discoveryUri();
        }
        return require(application.clientId()).flatMap(existing -> {
            LOG.infov("Updating application {0}", application.clientId());
            return repository.save(application.toBuilder()
                    .clientSecretHash(existing.clientSecretHash())
                    .createdAt(existing.createdAt())
                    .updatedAt(Instant.now())
                    .build());
        });
    }

    @Override
    public Uni<Application> deactivate(String clientId) {
        return require(clientId).flatMap(existing -> {
            LOG.infov("Deactivating application {0}", clientId);
            return repository.save(existing.toBuilder()
                    .active(false)
                    .updatedAt(Instant.now())
                    .build());
        });
    }

    @Override
    public Uni<Optional<Application>> get(String clientId) {
        return repository.findById(clientId);
    }

    @Override
    public Uni<List<Application>> list() {
        return repository.findAll();
    }

    @Override
    public Uni<String> rotateSecret(String clientId) {
        return require(clientId).flatMap(existing -> {
            final var secret = SecureTokens.randomUrlSafe(CLIENT_SECRET_BYTES);
            LOG.infov("Rotating client secret of {0}", clientId);
            return repository
                    .save(existing.toBuilder()
                            .clientSecretHash(SecureTokens.sha256Hex(secret))
                            .updatedAt(Instant.now())
                            .build())
                    .replaceWith(secret);
        });
    }

    @Override
    public Uni<Application> requireActive(String clientId) {
        return require(clientId).map(app -> {
            if (!app.active()) {
                throw new IllegalStateException("Application is inactive: " + clientId);
            }
            return app;
        });
    }

    private Uni<Application> require(String clientId) {
        return repository
                .findById(clientId)
                .map(opt -> opt.orElseThrow(() -> new EntityNotFoundException("Application", clientId)));
    }
}
