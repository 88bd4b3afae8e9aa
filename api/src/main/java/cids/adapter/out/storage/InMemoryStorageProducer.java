package cids.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import cids.adapter.out.storage.memory.InMemoryA2APermissionRepository;
import cids.adapter.out.storage.memory.InMemoryActivityLogRepository;
import cids.adapter.out.storage.memory.InMemoryApiKeyRepository;
import cids.adapter.out.storage.memory.InMemoryApplicationRepository;
import cids.adapter.out.storage.memory.InMemoryCapabilityGraphRepository;
import cids.adapter.out.storage.memory.InMemoryDiscoveryHistoryRepository;
import cids.adapter.out.storage.memory.InMemoryRefreshTokenRepository;
import cids.adapter.out.storage.memory.InMemoryRoleRepository;
import cids.adapter.out.storage.memory.InMemoryTokenRevocationRepository;
import cids.core.config.ActivityLogConfig;
import cids.core.port.out.A2APermissionRepository;
import cids.core.port.out.ActivityLogRepository;
import cids.core.port.out.ApiKeyRepository;
import cids.core.port.out.ApplicationRepository;
import cids.core.port.out.CapabilityGraphRepository;
import cids.core.port.out.DiscoveryHistoryRepository;
import cids.core.port.out.RefreshTokenRepository;
import cids.core.port.out.RoleRepository;
import cids.core.port.out.TokenRevocationRepository;

/**
 * CDI producer for the storage ports.
 *
 * <p>All stores are in-memory. A persistent backend replaces a port by providing an
 * {@code @Alternative @Priority(1)} bean of the same type.
 */
@ApplicationScoped
public class InMemoryStorageProducer {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProducer.class);

    @Produces
    @Singleton
    public ApplicationRepository applicationRepository() {
        LOG.info("Using in-memory application registry");
        return new InMemoryApplicationRepository();
    }

    @Produces
    @Singleton
    public ApiKeyRepository apiKeyRepository() {
        return new InMemoryApiKeyRepository();
    }

    @Produces
    @Singleton
    public CapabilityGraphRepository capabilityGraphRepository() {
        return new InMemoryCapabilityGraphRepository();
    }

    @Produces
    @Singleton
    public DiscoveryHistoryRepository discoveryHistoryRepository() {
        return new InMemoryDiscoveryHistoryRepository();
    }

    @Produces
    @Singleton
    public RoleRepository roleRepository() {
        return new InMemoryRoleRepository();
    }

    @Produces
    @Singleton
    public RefreshTokenRepository refreshTokenRepository() {
        return new InMemoryRefreshTokenRepository();
    }

    @Produces
    @Singleton
    public TokenRevocationRepository tokenRevocationRepository() {
        return new InMemoryTokenRevocationRepository();
    }

    @Produces
    @Singleton
    public ActivityLogRepository activityLogRepository(ActivityLogConfig config) {
        return new InMemoryActivityLogRepository(config.maxEntries());
    }

    @Produces
    @Singleton
    public A2APermissionRepository a2aPermissionRepository() {
        return new InMemoryA2APermissionRepository();
    }
}
