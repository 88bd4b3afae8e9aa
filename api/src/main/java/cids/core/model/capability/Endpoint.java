package cids.core.model.capability;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * An HTTP operation exposed by a registered application.
 *
 * @param path           request path, including any service base path
 * @param method         upper-case HTTP method
 * @param resource       resource the operation acts on
 * @param action         action performed on the resource
 * @param description    human-readable description
 * @param responseFields names of the resource fields the operation returns
 */
public record Endpoint(
        String path, String method, String resource, String action, String description, List<String> responseFields) {

    public static final Set<String> HTTP_METHODS =
            Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS");

    public Endpoint {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Endpoint path cannot be null or blank");
        }
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("Endpoint method cannot be null or blank");
        }
        method = method.trim().toUpperCase(Locale.ROOT);
        if (!HTTP_METHODS.contains(method)) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + method);
        }
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("Endpoint resource cannot be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Endpoint action cannot be null or blank");
        }
        if (description == null) {
            description = "";
        }
        responseFields = responseFields != null ? List.copyOf(responseFields) : List.of();
    }

    public boolean matches(String candidateResource, String candidateAction) {
        return resource.equals(candidateResource) && action.equals(candidateAction);
    }
}
