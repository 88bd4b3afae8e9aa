package cids.core.model.role;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import cids.core.model.permission.Grant;

/**
 * An application-scoped role owning grants and row filters.
 *
 * <p>Grants and filters are owned by the role and are removed with it.
 *
 * @param clientId    owning application
 * @param name        role name, unique within the application
 * @param description human-readable description
 * @param a2aOnly     role is only meaningful for service principals
 * @param active      inactive roles never contribute to resolution
 * @param defaultRole contributes to every principal with the lowest precedence
 * @param priority    precedence among group-derived roles, higher wins
 * @param grants      allow and deny grants in declaration order
 * @param rlsFilters  row filters in declaration order
 * @param createdAt   creation timestamp
 * @param updatedAt   last modification timestamp
 */
public record Role(
        String clientId,
        String name,
        String description,
        boolean a2aOnly,
        boolean active,
        boolean defaultRole,
        int priority,
        List<Grant> grants,
        List<RlsFilter> rlsFilters,
        Instant createdAt,
        Instant updatedAt) {

    public Role {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Role client ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Role name cannot be null or blank");
        }
        if (description == null) {
            description = "";
        }
        grants = grants != null ? List.copyOf(grants) : List.of();
        rlsFilters = rlsFilters != null ? List.copyOf(rlsFilters) : List.of();
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public static Builder builder(String clientId, String name) {
        return new Builder(clientId, name);
    }

    public Builder toBuilder() {
        return new Builder(clientId, name)
                .description(description)
                .a2aOnly(a2aOnly)
                .active(active)
                .defaultRole(defaultRole)
                .priority(priority)
                .grants(grants)
                .rlsFilters(rlsFilters)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public Role withGrants(List<Grant> newGrants) {
        return toBuilder().grants(newGrants).updatedAt(Instant.now()).build();
    }

    public Role withRlsFilters(List<RlsFilter> newFilters) {
        return toBuilder().rlsFilters(newFilters).updatedAt(Instant.now()).build();
    }

    public static class Builder {
        private final String clientId;
        private final String name;
        private String description;
        private boolean a2aOnly;
        private boolean active = true;
        private boolean defaultRole;
        private int priority;
        private List<Grant> grants = new ArrayList<>();
        private List<RlsFilter> rlsFilters = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String clientId, String name) {
            this.clientId = clientId;
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder a2aOnly(boolean a2aOnly) {
            this.a2aOnly = a2aOnly;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder defaultRole(boolean defaultRole) {
            this.defaultRole = defaultRole;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder grants(List<Grant> grants) {
            this.grants = grants != null ? new ArrayList<>(grants) : new ArrayList<>();
            return this;
        }

        public Builder grant(Grant grant) {
            this.grants.add(grant);
            return this;
        }

        public Builder rlsFilters(List<RlsFilter> rlsFilters) {
            this.rlsFilters = rlsFilters != null ? new ArrayList<>(rlsFilters) : new ArrayList<>();
            return this;
        }

        public Builder rlsFilter(RlsFilter filter) {
            this.rlsFilters.add(filter);
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

        public Role build() {
            return new Role(
                    clientId,
                    name,
                    description,
                    a2aOnly,
                    active,
                    defaultRole,
                    priority,
                    grants,
                    rlsFilters,
                    createdAt,
                    updatedAt);
        }
    }
}
