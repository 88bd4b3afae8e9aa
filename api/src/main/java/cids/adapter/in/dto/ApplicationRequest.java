package cids.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;

import cids.core.model.app.Application;

/**
 * Application registration or update.
 */
public record ApplicationRequest(
        @NotBlank String clientId,
        String name,
        String description,
        String owner,
        List<String> redirectUris,
        String discoveryEndpoint,
        Boolean allowDiscovery,
        Boolean ipBinding,
        Boolean deviceBinding) {

    public Application toApplication() {
        return Application.builder(clientId)
                .name(name)
                .description(description)
                .owner(owner)
                .redirectUris(redirectUris)
                .discoveryEndpoint(discoveryEndpoint)
                .allowDiscovery(allowDiscovery == null || allowDiscovery)
                .ipBinding(Boolean.TRUE.equals(ipBinding))
                .deviceBinding(Boolean.TRUE.equals(deviceBinding))
                .build();
    }

    /**
     * Apply the fields present in this request on top of an existing application.
     */
    public Application applyTo(Application existing) {
        final var builder = existing.toBuilder();
        if (name != null) {
            builder.name(name);
        }
        if (description != null) {
            builder.description(description);
        }
        if (owner != null) {
            builder.owner(owner);
        }
        if (redirectUris != null) {
            builder.redirectUris(redirectUris);
        }
        if (discoveryEndpoint != null) {
            builder.discoveryEndpoint(discoveryEndpoint);
        }
        if (allowDiscovery != null) {
            builder.allowDiscovery(allowDiscovery);
        }
        if (ipBinding != null) {
            builder.ipBinding(ipBinding);
        }
        if (deviceBinding != null) {
            builder.deviceBinding(deviceBinding);
        }
        return builder.build();
    }
}
