package cids.core.model.token;

import java.util.Set;

/**
 * A user authenticated by the identity provider.
 *
 * @param subject stable user identifier
 * @param email   email address, may be null
 * @param name    display name, may be null
 * @param groups  group display names the user belongs to
 */
public record VerifiedPrincipal(String subject, String email, String name, Set<String> groups) {

    public VerifiedPrincipal {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Principal subject cannot be null or blank");
        }
        groups = groups != null ? Set.copyOf(groups) : Set.of();
    }
}
