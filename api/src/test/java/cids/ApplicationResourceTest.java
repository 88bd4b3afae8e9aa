package cids;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.startsWith;

import java.util.UUID;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for application, API key and role administration.
 * Uses default test profile with dangerous-noop enabled.
 */
@QuarkusTest
@DisplayName("Application Resource Tests")
public class ApplicationResourceTest {

    private String clientId;

    @BeforeEach
    void setUp() {
        clientId = "app-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void registerApp() {
        given().contentType(ContentType.JSON)
                .body("""
                        {
                            "clientId": "%s",
                            "name": "Orders",
                            "redirectUris": ["https://orders.example.com/callback"]
                        }
                        """.formatted(clientId))
                .when()
                .post("/admin/apps")
                .then()
                .statusCode(201);
    }

    @Nested
    @DisplayName("Applications")
    class Applications {

        @Test
        @DisplayName("should register and fetch an application")
        void shouldRegister() {
            given().contentType(ContentType.JSON)
                    .body("""
                            {
                                "clientId": "%s",
                                "name": "Orders",
                                "ipBinding": true
                            }
                            """.formatted(clientId))
                    .when()
                    .post("/admin/apps")
                    .then()
                    .statusCode(201)
                    .body("clientId", equalTo(clientId))
                    .body("active", equalTo(true))
                    .body("allowDiscovery", equalTo(true))
                    .body("ipBinding", equalTo(true));

            given().when()
                    .get("/admin/apps/" + clientId)
                    .then()
                    .statusCode(200)
                    .body("name", equalTo("Orders"))
                    .body("hasClientSecret", equalTo(false));
        }

        @Test
        @DisplayName("should reject a duplicate registration")
        void shouldRejectDuplicate() {
            registerApp();

            given().contentType(ContentType.JSON)
                    .body("{\"clientId\": \"%s\"}".formatted(clientId))
                    .when()
                    .post("/admin/apps")
                    .then()
                    .statusCode(409)
                    .contentType("application/problem+json");
        }

        @Test
        @DisplayName("should reject a registration without client ID")
        void shouldRejectMissingClientId() {
            given().contentType(ContentType.JSON)
                    .body("{\"name\": \"Nameless\"}")
                    .when()
                    .post("/admin/apps")
                    .then()
                    .statusCode(400);
        }

        @Test
        @DisplayName("should reject an invalid client ID")
        void shouldRejectInvalidClientId() {
            given().contentType(ContentType.JSON)
                    .body("{\"clientId\": \"Not Valid!\"}")
                    .when()
                    .post("/admin/apps")
                    .then()
                    .statusCode(400)
                    .contentType("application/problem+json");
        }

        @Test
        @DisplayName("should return 404 for unknown application")
        void shouldReturn404ForUnknown() {
            given().when()
                    .get("/admin/apps/" + clientId)
                    .then()
                    .statusCode(404)
                    .contentType("application/problem+json");
        }

        @Test
        @DisplayName("should update only the fields present")
        void shouldPatchFields() {
            registerApp();

            given().contentType(ContentType.JSON)
                    .body("{\"description\": \"Order service\"}")
                    .when()
                    .put("/admin/apps/" + clientId)
                    .then()
                    .statusCode(200)
                    .body("description", equalTo("Order service"))
                    .body("name", equalTo("Orders"));
        }

        @Test
        @DisplayName("should deactivate an application")
        void shouldDeactivate() {
            registerApp();

            given().when()
                    .delete("/admin/apps/" + clientId)
                    .then()
                    .statusCode(200)
                    .body("active", equalTo(false));
        }

        @Test
        @DisplayName("should issue a client secret once")
        void shouldRotateSecret() {
            registerApp();

            given().when()
                    .post("/admin/apps/" + clientId + "/secret")
                    .then()
                    .statusCode(200)
                    .body("clientSecret", notNullValue());

            given().when()
                    .get("/admin/apps/" + clientId)
                    .then()
                    .statusCode(200)
                    .body("hasClientSecret", equalTo(true));
        }
    }

    @Nested
    @DisplayName("API keys")
    class ApiKeys {

        @Test
        @DisplayName("should create an API key and return the plaintext once")
        void shouldCreateApiKey() {
            registerApp();

            final String keyId = given().contentType(ContentType.JSON)
                    .body("{\"name\": \"ci\", \"ttlDays\": 30}")
                    .when()
                    .post("/admin/apps/" + clientId + "/api-keys")
                    .then()
                    .statusCode(201)
                    .body("key", startsWith("cids_ak_"))
                    .body("metadata.expiresAt", notNullValue())
                    .extract()
                    .path("keyId");

            given().when()
                    .get("/admin/apps/" + clientId + "/api-keys")
                    .then()
                    .statusCode(200)
                    .body("$", hasSize(1))
                    .body("[0].id", equalTo(keyId))
                    .body("[0].keyHash", equalTo("[REDACTED]"));
        }

        @Test
        @DisplayName("should revoke an API key")
        void shouldRevokeApiKey() {
            registerApp();
            final String keyId = given().contentType(ContentType.JSON)
                    .body("{\"name\": \"temp\"}")
                    .when()
                    .post("/admin/apps/" + clientId + "/api-keys")
                    .then()
                    .statusCode(201)
                    .extract()
                    .path("keyId");

            given().when()
                    .delete("/admin/apps/" + clientId + "/api-keys/" + keyId)
                    .then()
                    .statusCode(204);

            given().when()
                    .delete("/admin/apps/" + clientId + "/api-keys/missing")
                    .then()
                    .statusCode(404);
        }

        @Test
        @DisplayName("should rotate an API key")
        void shouldRotateApiKey() {
            registerApp();
            final String keyId = given().contentType(ContentType.JSON)
                    .body("{\"name\": \"rotating\"}")
                    .when()
                    .post("/admin/apps/" + clientId + "/api-keys")
                    .then()
                    .statusCode(201)
                    .extract()
                    .path("keyId");

            given().when()
                    .post("/admin/apps/" + clientId + "/api-keys/" + keyId + "/rotate")
                    .then()
                    .statusCode(201)
                    .body("key", startsWith("cids_ak_"));

            given().when()
                    .get("/admin/apps/" + clientId + "/api-keys")
                    .then()
                    .statusCode(200)
                    .body("$", hasSize(2));
        }
    }

    @Nested
    @DisplayName("Roles")
    class Roles {

        @Test
        @DisplayName("should create a role and map a group to it")
        void shouldCreateRoleAndMapping() {
            registerApp();

            given().contentType(ContentType.JSON)
                    .body("""
                            {
                                "name": "viewer",
                                "grants": ["employees:read", "!employees.read.salary"]
                            }
                            """)
                    .when()
                    .post("/admin/apps/" + clientId + "/roles")
                    .then()
                    .statusCode(201)
                    .body("grants", hasItem("employees.read"))
                    .body("grants", hasItem("!employees.read.salary"));

            given().contentType(ContentType.JSON)
                    .body("{\"groupName\": \"HR Staff\", \"roleName\": \"viewer\"}")
                    .when()
                    .post("/admin/apps/" + clientId + "/mappings")
                    .then()
                    .statusCode(201);

            given().when()
                    .get("/admin/apps/" + clientId + "/mappings")
                    .then()
                    .statusCode(200)
                    .body("$", hasSize(1))
                    .body("[0].groupName", equalTo("HR Staff"));
        }

        @Test
        @DisplayName("should report grants as stale before discovery")
        void shouldReportStaleGrants() {
            registerApp();
            given().contentType(ContentType.JSON)
                    .body("{\"name\": \"viewer\", \"grants\": [\"employees.read\"]}")
                    .when()
                    .post("/admin/apps/" + clientId + "/roles")
                    .then()
                    .statusCode(201);

            given().when()
                    .get("/admin/apps/" + clientId + "/stale-grants")
                    .then()
                    .statusCode(200)
                    .body("$", hasItem("viewer:employees.read"));
        }

        @Test
        @DisplayName("should reject a malformed grant")
        void shouldRejectMalformedGrant() {
            registerApp();

            given().contentType(ContentType.JSON)
                    .body("{\"name\": \"broken\", \"grants\": [\"employees\"]}")
                    .when()
                    .post("/admin/apps/" + clientId + "/roles")
                    .then()
                    .statusCode(400)
                    .contentType("application/problem+json");
        }

        @Test
        @DisplayName("should return 404 for an unknown role")
        void shouldReturn404ForUnknownRole() {
            registerApp();

            given().when()
                    .get("/admin/apps/" + clientId + "/roles/ghost")
                    .then()
                    .statusCode(404)
                    .body("detail", notNullValue());
        }
    }
}
