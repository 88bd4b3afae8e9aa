package cids.adapter.in.dto;

import java.time.Instant;
import java.util.List;

import cids.core.model.app.Application;

/**
 * Application as exposed by the admin API. The secret hash is never returned.
 */
public record ApplicationResponse(
        String clientId,
        String name,
        String description,
        String owner,
        List<String> redirectUris,
        String discoveryEndpoint,
        boolean allowDiscovery,
        boolean active,
        boolean ipBinding,
        boolean deviceBinding,
        boolean hasClientSecret,
        Instant createdAt,
        Instant updatedAt) {

    public static ApplicationResponse from(Application app) {
        return new ApplicationResponse(
                app.clientId(),
                app.name(),
                app.description(),
                app.owner(),
                app.redirectUris(),
                app.discoveryEndpoint(),
                app.allowDiscovery(),
                app.active(),
                app.ipBinding(),
                app.deviceBinding(),
                app.clientSecretHash() != null,
                app.createdAt(),
                app.updatedAt());
    }
}
