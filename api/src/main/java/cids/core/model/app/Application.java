package cids.core.model.app;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A client application registered with the broker.
 *
 * <p>Applications are soft-deactivated and never deleted, so tokens and audit
 * records that reference them stay resolvable.
 *
 * @param clientId          stable identifier, also the audience of its user tokens
 * @param name              display name
 * @param description       free text
 * @param owner             owning team or person
 * @param redirectUris      registered login redirect URIs
 * @param discoveryEndpoint URL of the discovery document, null if discovery is not set up
 * @param allowDiscovery    whether the broker may call the discovery endpoint
 * @param active            deactivated applications cannot receive tokens
 * @param ipBinding         snapshot the caller IP into user tokens
 * @param deviceBinding     snapshot the device fingerprint into user tokens
 * @param clientSecretHash  SHA-256 of the client secret, null when none was issued
 * @param createdAt         registration time
 * @param updatedAt         last modification time
 */
public record Application(
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
        String clientSecretHash,
        Instant createdAt,
        Instant updatedAt) {

    public static final Pattern CLIENT_ID = Pattern.compile("[a-z0-9][a-z0-9_\\-]{1,63}");

    public Application {
        if (clientId == null || !CLIENT_ID.matcher(clientId).matches()) {
            throw new IllegalArgumentException("Invalid client ID: " + clientId);
        }
        if (name == null || name.isBlank()) {
            name = clientId;
        }
        if (description == null) {
            description = "";
        }
        redirectUris = redirectUris != null ? List.copyOf(redirectUris) : List.of();
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public boolean isRedirectUriAllowed(String redirectUri) {
        return redirectUri != null && redirectUris.contains(redirectUri);
    }

    /**
     * Parsed discovery URL.
     *
     * @throws IllegalArgumentException if the endpoint is missing or not an absolute http(s) URL
     */
    public URI discoveryUri() {
        if (discoveryEndpoint == null || discoveryEndpoint.isBlank()) {
            throw new IllegalArgumentException("Application " + clientId + " has no discovery endpoint");
        }
        final URI uri;
        try {
            uri = URI.create(discoveryEndpoint.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed discovery endpoint: " + discoveryEndpoint, e);
        }
        if (uri.getScheme() == null
                || !(uri.getScheme().equals("http") || uri.getScheme().equals("https"))
                || uri.getHost() == null) {
            throw new IllegalArgumentException("Discovery endpoint must be an absolute http(s) URL: " + discoveryEndpoint);
        }
        return uri;
    }

    public Builder toBuilder() {
        return new Builder(clientId)
                .name(name)
                .description(description)
                .owner(owner)
                .redirectUris(redirectUris)
                .discoveryEndpoint(discoveryEndpoint)
                .allowDiscovery(allowDiscovery)
                .active(active)
                .ipBinding(ipBinding)
                .deviceBinding(deviceBinding)
                .clientSecretHash(clientSecretHash)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder(String clientId) {
        return new Builder(clientId);
    }

    public static class Builder {
        private final String clientId;
        private String name;
        private String description;
        private String owner;
        private List<String> redirectUris = List.of();
        private String discoveryEndpoint;
        private boolean allowDiscovery = true;
        private boolean active = true;
        private boolean ipBinding;
        private boolean deviceBinding;
        private String clientSecretHash;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String clientId) {
            this.clientId = clientId;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder redirectUris(List<String> redirectUris) {
            this.redirectUris = redirectUris;
            return this;
        }

        public Builder discoveryEndpoint(String discoveryEndpoint) {
            this.discoveryEndpoint = discoveryEndpoint;
            return this;
        }

        public Builder allowDiscovery(boolean allowDiscovery) {
            this.allowDiscovery = allowDiscovery;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder ipBinding(boolean ipBinding) {
            this.ipBinding = ipBinding;
            return this;
        }

        public Builder deviceBinding(boolean deviceBinding) {
            this.deviceBinding = deviceBinding;
            return this;
        }

        public Builder clientSecretHash(String clientSecretHash) {
            this.clientSecretHash = clientSecretHash;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Application build() {
            return new Application(
                    clientId,
                    name,
                    description,
                    owner,
                    redirectUris,
                    discoveryEndpoint,
                    allowDiscovery,
                    active,
                    ipBinding,
                    deviceBinding,
                    clientSecretHash,
                    createdAt,
                    updatedAt);
        }
    }
}
