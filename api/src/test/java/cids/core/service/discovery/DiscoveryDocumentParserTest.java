package cids.core.service.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import cids.core.model.capability.SensitivityCategory;
import cids.core.model.discovery.DiscoveryErrorType;
import cids.core.model.discovery.DiscoveryException;

@DisplayName("DiscoveryDocumentParser")
class DiscoveryDocumentParserTest {

    private static final String CLIENT = "hr-app";

    private DiscoveryDocumentParser parser;

    @BeforeEach
    void setUp() {
        parser = new DiscoveryDocumentParser(new ObjectMapper());
    }

    private static String document(String body) {
        return """
                {
                  "app_id": "hr-app",
                  "app_name": "HR",
                  "version": "2.0",
                  "last_updated": "2024-03-01T10:00:00Z",
                  %s
                }
                """.formatted(body);
    }

    private static final String FLAT = document("""
            "endpoints": [
              {"method": "GET", "path": "/api/employees", "resource": "employees", "action": "read",
               "response_fields": ["id", "email"]}
            ],
            "response_fields": {
              "employees": {
                "id": {"type": "string", "category": "base"},
                "email": {"type": "string", "category": "pii"}
              }
            }
            """);

    private DiscoveryException rejects(String body) {
        final var e = assertThrows(DiscoveryException.class, () -> parser.parse(CLIENT, body, "2.0"));
        assertEquals(DiscoveryErrorType.VALIDATION_ERROR, e.errorType());
        return e;
    }

    @Nested
    @DisplayName("flat endpoints")
    class FlatEndpoints {

        @Test
        @DisplayName("should build a draft graph with fields")
        void shouldParseFlatDocument() {
            final var parsed = parser.parse(CLIENT, FLAT, "2.0");

            final var graph = parsed.graph();
            assertEquals(0L, graph.version());
            assertEquals("HR", graph.appName());
            assertEquals(Instant.parse("2024-03-01T10:00:00Z"), graph.lastUpdated());
            assertTrue(graph.hasAction("employees", "read"));
            assertEquals(
                    SensitivityCategory.PII,
                    graph.field("employees", "email").orElseThrow().category());
            assertTrue(parsed.warnings().isEmpty());
        }

        @Test
        @DisplayName("should reject references to undeclared fields")
        void shouldRejectUndeclaredField() {
            rejects(FLAT.replace("[\"id\", \"email\"]", "[\"id\", \"ssn\"]"));
        }

        @Test
        @DisplayName("should merge inline response field objects")
        void shouldMergeInlineFields() {
            final var parsed = parser.parse(
                    CLIENT,
                    document("""
                            "endpoints": [
                              {"method": "GET", "path": "/api/employees", "resource": "employees", "action": "read",
                               "response_fields": {"salary": {"type": "number", "category": "financial"}}}
                            ]
                            """),
                    "2.0");

            final var salary = parsed.graph().field("employees", "salary").orElseThrow();
            assertEquals("number", salary.type());
            assertEquals(SensitivityCategory.FINANCIAL, salary.category());
        }

        @Test
        @DisplayName("should flatten nested object and array fields to dotted paths")
        void shouldFlattenNestedFields() {
            final var parsed = parser.parse(
                    CLIENT,
                    document("""
                            "endpoints": [
                              {"method": "GET", "path": "/api/employees", "resource": "employees", "action": "read",
                               "response_fields": {
                                 "address": {"type": "object", "category": "pii",
                                             "fields": {"city": {"type": "string", "category": "base"}}},
                                 "dependents": {"type": "array", "category": "pii",
                                                "items": {"type": "object",
                                                          "fields": {"name": {"type": "string", "category": "phi"}}}}
                               }},
                              {"method": "DELETE", "path": "/api/employees/{id}", "resource": "employees",
                               "action": "delete"}
                            ]
                            """),
                    "2.0");

            final var graph = parsed.graph();
            assertEquals(
                    SensitivityCategory.BASE,
                    graph.field("employees", "address.city").orElseThrow().category());
            assertEquals(
                    SensitivityCategory.PHI,
                    graph.field("employees", "dependents.name").orElseThrow().category());
            assertTrue(graph.fieldsFor("employees", "read").containsKey("address.city"));
            assertTrue(graph.fieldsFor("employees", "delete").isEmpty());
        }

        @Test
        @DisplayName("should make nested children of a referenced field reachable")
        void shouldReachNestedChildrenByReference() {
            final var parsed = parser.parse(
                    CLIENT,
                    document("""
                            "endpoints": [
                              {"method": "GET", "path": "/api/employees", "resource": "employees", "action": "read",
                               "response_fields": ["address"]}
                            ],
                            "response_fields": {
                              "employees": {
                                "address": {"type": "object", "category": "pii",
                                            "fields": {"zip": {"type": "string", "category": "pii"}}}
                              }
                            }
                            """),
                    "2.0");

            assertEquals(
                    Set.of("address", "address.zip"),
                    parsed.graph().fieldsFor("employees", "read").keySet());
        }

        @Test
        @DisplayName("should warn about and drop duplicate endpoints")
        void shouldDropDuplicates() {
            final var parsed = parser.parse(
                    CLIENT,
                    document("""
                            "endpoints": [
                              {"method": "GET", "path": "/api/employees", "resource": "employees", "action": "read"},
                              {"method": "get", "path": "/api/employees", "resource": "employees", "action": "list"}
                            ]
                            """),
                    "2.0");

            assertEquals(1, parsed.graph().endpoints().size());
            assertEquals(1, parsed.warnings().size());
        }
    }

    @Nested
    @DisplayName("services layout")
    class Services {

        @Test
        @DisplayName("should prefix paths and derive resource and action")
        void shouldDeriveNames() {
            final var parsed = parser.parse(
                    CLIENT,
                    document("""
                            "services": [
                              {"name": "core", "base_path": "/api/", "endpoints": [
                                {"method": "GET", "path": "/orders/{id}/items"},
                                {"method": "DELETE", "path": "orders/{id}", "resource": "orders"}
                              ]}
                            ]
                            """),
                    "2.0");

            final var endpoints = parsed.graph().endpoints();
            assertEquals("/api/orders/{id}/items", endpoints.get(0).path());
            assertEquals("orders_items", endpoints.get(0).resource());
            assertEquals("read", endpoints.get(0).action());
            assertEquals("/api/orders/{id}", endpoints.get(1).path());
            assertEquals("delete", endpoints.get(1).action());
        }

        @Test
        @DisplayName("should reject documents with both endpoints and services")
        void shouldRejectBothLayouts() {
            rejects(document("""
                    "endpoints": [{"method": "GET", "path": "/a", "resource": "a", "action": "read"}],
                    "services": [{"endpoints": [{"method": "GET", "path": "/b"}]}]
                    """));
        }

        @Test
        @DisplayName("should reject services without endpoints")
        void shouldRejectEmptyServices() {
            rejects(document("""
                    "services": [{"name": "empty", "endpoints": []}]
                    """));
        }
    }

    @Nested
    @DisplayName("field classification")
    class Classification {

        private String withField(String field) {
            return document("""
                    "endpoints": [{"method": "GET", "path": "/p", "resource": "patients", "action": "read"}],
                    "response_fields": {"patients": {"f": %s}}
                    """.formatted(field));
        }

        @Test
        @DisplayName("should prefer phi over pii in legacy flags")
        void shouldPreferPhi() {
            final var graph = parser.parse(CLIENT, withField("{\"pii\": true, \"phi\": true}"), "2.0").graph();

            assertEquals(SensitivityCategory.PHI, graph.field("patients", "f").orElseThrow().category());
        }

        @Test
        @DisplayName("should classify all-false legacy flags as base")
        void shouldClassifyFalseFlagsAsBase() {
            final var graph = parser.parse(CLIENT, withField("{\"sensitive\": false}"), "2.0").graph();

            assertEquals(SensitivityCategory.BASE, graph.field("patients", "f").orElseThrow().category());
        }

        @Test
        @DisplayName("should keep fields without classification and warn")
        void shouldWarnOnUnclassified() {
            final var parsed = parser.parse(CLIENT, withField("{\"type\": \"string\"}"), "2.0");

            assertNull(parsed.graph().field("patients", "f").orElseThrow().category());
            assertFalse(parsed.warnings().isEmpty());
        }

        @Test
        @DisplayName("should reject unknown and wildcard categories")
        void shouldRejectBadCategories() {
            rejects(withField("{\"category\": \"secret\"}"));
            rejects(withField("{\"category\": \"*\"}"));
        }
    }

    @Nested
    @DisplayName("document validation")
    class Validation {

        @Test
        @DisplayName("should reject invalid JSON")
        void shouldRejectInvalidJson() {
            rejects("{not json");
        }

        @Test
        @DisplayName("should reject a mismatched app_id")
        void shouldRejectWrongAppId() {
            rejects(FLAT.replace("\"hr-app\"", "\"other-app\""));
        }

        @Test
        @DisplayName("should reject an unsupported version")
        void shouldRejectWrongVersion() {
            rejects(FLAT.replace("\"2.0\"", "\"1.0\""));
        }

        @Test
        @DisplayName("should accept timestamps without an offset as UTC")
        void shouldAcceptLocalTimestamp() {
            assertEquals(
                    Instant.parse("2024-03-01T10:00:00Z"),
                    DiscoveryDocumentParser.parseTimestamp("2024-03-01T10:00:00"));
        }

        @Test
        @DisplayName("should reject missing endpoints")
        void shouldRejectMissingEndpoints() {
            rejects(document("\"response_fields\": {}"));
        }
    }

    @Nested
    @DisplayName("name derivation")
    class NameDerivation {

        @Test
        @DisplayName("should strip api prefix and path parameters")
        void shouldDeriveResource() {
            assertEquals("v1_users_orders", DiscoveryDocumentParser.resourceFromPath("/api/v1/users/{id}/orders"));
            assertEquals("root", DiscoveryDocumentParser.resourceFromPath("/api/"));
        }

        @Test
        @DisplayName("should map HTTP methods to actions")
        void shouldDeriveAction() {
            assertEquals("update", DiscoveryDocumentParser.actionFromMethod("patch"));
            assertEquals("check", DiscoveryDocumentParser.actionFromMethod("HEAD"));
            assertEquals("execute", DiscoveryDocumentParser.actionFromMethod("TRACE"));
        }
    }
}
