package cids.core.service.discovery;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import cids.core.model.capability.CapabilityGraph;
import cids.core.model.capability.Endpoint;
import cids.core.model.capability.FieldMetadata;
import cids.core.model.capability.SensitivityCategory;
import cids.core.model.discovery.DiscoveryException;

/**
 * Turns a discovery document into a draft capability graph.
 *
 * <p>Two layouts are accepted: a flat {@code endpoints} array, or a {@code services}
 * array whose endpoint paths are prefixed with each service's {@code base_path}.
 * Field metadata comes from the top-level {@code response_fields} map, or inline
 * from an endpoint's {@code response_fields} object. Any structural problem is a
 * {@code VALIDATION_ERROR}.
 */
@ApplicationScoped
public class DiscoveryDocumentParser {

    private final ObjectMapper objectMapper;

    @Inject
    public DiscoveryDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * A draft graph, version 0, and the non-fatal issues found while reading it.
     */
    public record ParsedDocument(CapabilityGraph graph, List<String> warnings) {}

    /**
     * @param clientId        the application the document must describe
     * @param body            raw response body
     * @param expectedVersion supported schema version
     * @throws DiscoveryException with {@code VALIDATION_ERROR} if the document is not acceptable
     */
    public ParsedDocument parse(String clientId, String body, String expectedVersion) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw DiscoveryException.validation("Discovery response is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw DiscoveryException.validation("Discovery response must be a JSON object");
        }

        final var appId = text(root, "app_id");
        if (!clientId.equals(appId)) {
            throw DiscoveryException.validation(
                    "app_id mismatch: expected '%s' but document declares '%s'".formatted(clientId, appId));
        }
        final var appName = text(root, "app_name");
        if (appName == null || appName.isBlank()) {
            throw DiscoveryException.validation("app_name is required");
        }
        final var version = text(root, "version");
        if (!expectedVersion.equals(version)) {
            throw DiscoveryException.validation(
                    "Unsupported discovery version '%s', expected '%s'".formatted(version, expectedVersion));
        }
        final var lastUpdated = parseTimestamp(text(root, "last_updated"));

        final var warnings = new ArrayList<String>();
        final var fields = new LinkedHashMap<String, Map<String, FieldMetadata>>();
        final var declared = root.get("response_fields");
        if (declared != null && !declared.isNull()) {
            if (!declared.isObject()) {
                throw DiscoveryException.validation("response_fields must be an object keyed by resource");
            }
            declared.fields().forEachRemaining(resource -> {
                if (!resource.getValue().isObject()) {
                    throw DiscoveryException.validation(
                            "response_fields." + resource.getKey() + " must be an object keyed by field");
                }
                final var resourceFields = fields.computeIfAbsent(resource.getKey(), r -> new LinkedHashMap<>());
                resource.getValue().fields().forEachRemaining(field -> declare(
                        resource.getKey(), field.getKey(), field.getValue(), resourceFields, warnings, null));
            });
        }

        final var endpoints = new ArrayList<Endpoint>();
        final var hasEndpoints = root.hasNonNull("endpoints");
        final var hasServices = root.hasNonNull("services");
        if (hasEndpoints && hasServices) {
            throw DiscoveryException.validation("Specify either endpoints or services, not both");
        }
        if (hasEndpoints) {
            final var array = requireNonEmptyArray(root.get("endpoints"), "endpoints");
            array.forEach(node -> endpoints.add(endpoint(node, "", false, fields, warnings)));
        } else if (hasServices) {
            final var services = requireNonEmptyArray(root.get("services"), "services");
            for (var service : services) {
                final var basePath = service.hasNonNull("base_path") ? service.get("base_path").asText() : "/";
                final var serviceEndpoints = service.get("endpoints");
                if (serviceEndpoints == null || !serviceEndpoints.isArray()) {
                    throw DiscoveryException.validation(
                            "Service '%s' has no endpoints array".formatted(text(service, "name")));
                }
                serviceEndpoints.forEach(node -> endpoints.add(endpoint(node, basePath, true, fields, warnings)));
            }
            if (endpoints.isEmpty()) {
                throw DiscoveryException.validation("services declare no endpoints");
            }
        } else {
            throw DiscoveryException.validation("Discovery response must contain endpoints or services");
        }

        final var unique = dedupe(endpoints, warnings);
        for (var resource : fields.keySet()) {
            if (unique.stream().noneMatch(e -> e.resource().equals(resource))) {
                warnings.add("Resource '%s' declares fields but no endpoint".formatted(resource));
            }
        }

        final var graph = new CapabilityGraph(clientId, appName, 0L, lastUpdated, Instant.now(), unique, fields);
        return new ParsedDocument(graph, warnings);
    }

    private Endpoint endpoint(
            JsonNode node,
            String basePath,
            boolean deriveNames,
            Map<String, Map<String, FieldMetadata>> fields,
            List<String> warnings) {
        if (!node.isObject()) {
            throw DiscoveryException.validation("Endpoint entries must be objects");
        }
        final var rawPath = text(node, "path");
        final var method = text(node, "method");
        if (rawPath == null || rawPath.isBlank() || method == null || method.isBlank()) {
            throw DiscoveryException.validation("Endpoint is missing path or method");
        }
        final var path = joinPath(basePath, rawPath);

        var resource = text(node, "resource");
        var action = text(node, "action");
        if (deriveNames) {
            resource = resource != null && !resource.isBlank() ? resource : resourceFromPath(path);
            action = action != null && !action.isBlank() ? action : actionFromMethod(method);
        }
        if (resource == null || resource.isBlank() || action == null || action.isBlank()) {
            throw DiscoveryException.validation(
                    "Endpoint %s %s is missing resource or action".formatted(method, path));
        }

        final var referenced = new ArrayList<String>();
        final var responseFields = node.get("response_fields");
        if (responseFields != null && responseFields.isArray()) {
            for (var name : responseFields) {
                final var fieldName = name.asText();
                final var metadata = fields.getOrDefault(resource, Map.of()).get(fieldName);
                if (metadata == null) {
                    throw DiscoveryException.validation("Endpoint %s %s references undeclared field '%s' of '%s'"
                            .formatted(method, path, fieldName, resource));
                }
                if (!metadata.isClassified()) {
                    warnings.add("Field '%s' of '%s' has no category".formatted(fieldName, resource));
                }
                referenced.add(fieldName);
                fields.get(resource).keySet().stream()
                        .filter(nested -> nested.startsWith(fieldName + "."))
                        .forEach(referenced::add);
            }
        } else if (responseFields != null && responseFields.isObject()) {
            final var resourceFields = fields.computeIfAbsent(resource, r -> new LinkedHashMap<>());
            final var owner = resource;
            responseFields.fields().forEachRemaining(
                    field -> declare(owner, field.getKey(), field.getValue(), resourceFields, warnings, referenced));
        } else if (responseFields != null && !responseFields.isNull()) {
            throw DiscoveryException.validation(
                    "Endpoint %s %s has malformed response_fields".formatted(method, path));
        }

        try {
            return new Endpoint(path, method, resource, action, text(node, "description"), referenced);
        } catch (IllegalArgumentException e) {
            throw DiscoveryException.validation(e.getMessage());
        }
    }

    /**
     * Declares a field and, for {@code object} fields and arrays of objects, its
     * children as dotted paths such as {@code address.city}. The first declaration
     * of a path wins.
     */
    private void declare(
            String resource,
            String path,
            JsonNode node,
            Map<String, FieldMetadata> target,
            List<String> warnings,
            List<String> referenced) {
        target.putIfAbsent(path, field(resource, path, node, warnings));
        if (referenced != null) {
            referenced.add(path);
        }
        var children = node.get("fields");
        final var items = node.get("items");
        if ((children == null || !children.isObject()) && items != null && items.isObject()) {
            children = items.get("fields");
        }
        if (children == null || children.isNull()) {
            return;
        }
        if (!children.isObject()) {
            throw DiscoveryException.validation(
                    "Nested fields of '%s' in '%s' must be an object".formatted(path, resource));
        }
        children.fields().forEachRemaining(child -> declare(
                resource, path + "." + child.getKey(), child.getValue(), target, warnings, referenced));
    }

    private FieldMetadata field(String resource, String name, JsonNode node, List<String> warnings) {
        if (!node.isObject()) {
            throw DiscoveryException.validation("Field '%s' of '%s' must be an object".formatted(name, resource));
        }
        final var category = category(resource, name, node);
        if (category == null) {
            warnings.add("Field '%s' of '%s' is unclassified, only wildcard grants reach it".formatted(name, resource));
        }
        try {
            return new FieldMetadata(
                    name,
                    text(node, "type"),
                    category,
                    node.path("nullable").asBoolean(false),
                    text(node, "description"),
                    node.path("searchable").asBoolean(false),
                    node.path("filterable").asBoolean(false),
                    node.hasNonNull("max_length") ? node.get("max_length").asInt() : null,
                    text(node, "format"));
        } catch (IllegalArgumentException e) {
            throw DiscoveryException.validation(e.getMessage());
        }
    }

    /**
     * The declared category, or one derived from the legacy {@code phi}, {@code pii}
     * and {@code sensitive} flags in that order. Null when neither is present.
     */
    private SensitivityCategory category(String resource, String name, JsonNode node) {
        final var label = text(node, "category");
        if (label != null) {
            final var category = SensitivityCategory.fromLabel(label)
                    .filter(c -> !c.isWildcard())
                    .orElseThrow(() -> DiscoveryException.validation(
                            "Field '%s' of '%s' has unknown category '%s'".formatted(name, resource, label)));
            return category;
        }
        if (!node.has("phi") && !node.has("pii") && !node.has("sensitive")) {
            return null;
        }
        if (node.path("phi").asBoolean(false)) {
            return SensitivityCategory.PHI;
        }
        if (node.path("pii").asBoolean(false)) {
            return SensitivityCategory.PII;
        }
        if (node.path("sensitive").asBoolean(false)) {
            return SensitivityCategory.SENSITIVE;
        }
        return SensitivityCategory.BASE;
    }

    private static List<Endpoint> dedupe(List<Endpoint> endpoints, List<String> warnings) {
        final var seen = new HashSet<String>();
        final var unique = new ArrayList<Endpoint>();
        for (var endpoint : endpoints) {
            if (seen.add(endpoint.method() + " " + endpoint.path())) {
                unique.add(endpoint);
            } else {
                warnings.add("Duplicate endpoint %s %s ignored".formatted(endpoint.method(), endpoint.path()));
            }
        }
        return unique;
    }

    private static JsonNode requireNonEmptyArray(JsonNode node, String name) {
        if (!node.isArray() || node.isEmpty()) {
            throw DiscoveryException.validation(name + " must be a non-empty array");
        }
        return node;
    }

    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            throw DiscoveryException.validation("last_updated is required");
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException inner) {
                throw DiscoveryException.validation("last_updated is not an ISO-8601 timestamp: " + value);
            }
        }
    }

    static String joinPath(String basePath, String path) {
        if (basePath == null || basePath.isBlank() || "/".equals(basePath)) {
            return path.startsWith("/") ? path : "/" + path;
        }
        final var base = basePath.endsWith("/") ? basePath.substring(0, basePath.length() - 1) : basePath;
        return (base.startsWith("/") ? base : "/" + base) + (path.startsWith("/") ? path : "/" + path);
    }

    /**
     * {@code /api/v1/users/{id}/orders} becomes {@code v1_users_orders}.
     */
    static String resourceFromPath(String path) {
        final var parts = new ArrayList<String>();
        final var segments = path.replaceAll("^/+|/+$", "").split("/");
        for (int i = 0; i < segments.length; i++) {
            final var segment = segments[i];
            if (segment.isEmpty() || (i == 0 && "api".equals(segment))
                    || (segment.startsWith("{") && segment.endsWith("}"))) {
                continue;
            }
            parts.add(segment);
        }
        return parts.isEmpty() ? "root" : String.join("_", parts);
    }

    static String actionFromMethod(String method) {
        return switch (method.trim().toUpperCase(Locale.ROOT)) {
            case "GET" -> "read";
            case "POST" -> "create";
            case "PUT", "PATCH" -> "update";
            case "DELETE" -> "delete";
            case "HEAD" -> "check";
            case "OPTIONS" -> "options";
            default -> "execute";
        };
    }

    private static String text(JsonNode node, String field) {
        final var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
