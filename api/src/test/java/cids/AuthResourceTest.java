package cids;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.notNullValue;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import cids.core.model.token.ClientContext;
import cids.core.model.token.VerifiedPrincipal;
import cids.core.service.token.TokenIssuanceService;

/**
 * Integration tests for the token endpoints under {@code /auth}.
 * Uses default test profile with dangerous-noop enabled.
 */
@QuarkusTest
@DisplayName("Auth Resource Tests")
public class AuthResourceTest {

    @Inject
    TokenIssuanceService tokens;

    private String source;
    private String target;

    @BeforeEach
    void setUp() {
        final var suffix = UUID.randomUUID().toString().substring(0, 8);
        source = "src-" + suffix;
        target = "tgt-" + suffix;
    }

    private void register(String clientId) {
        given().contentType(ContentType.JSON)
                .body("{\"clientId\": \"%s\"}".formatted(clientId))
                .when()
                .post("/admin/apps")
                .then()
                .statusCode(201);
    }

    private String createApiKey(String clientId) {
        return given().contentType(ContentType.JSON)
                .body("{\"name\": \"a2a\"}")
                .when()
                .post("/admin/apps/" + clientId + "/api-keys")
                .then()
                .statusCode(201)
                .extract()
                .path("key");
    }

    private void allow(String scopes) {
        given().contentType(ContentType.JSON)
                .body("""
                        {
                            "sourceClientId": "%s",
                            "targetClientId": "%s",
                            "allowedScopes": %s,
                            "maxTokenDurationSeconds": 120
                        }
                        """.formatted(source, target, scopes))
                .when()
                .post("/admin/a2a")
                .then()
                .statusCode(201);
    }

    @Nested
    @DisplayName("POST /auth/validate")
    class Validate {

        @Test
        @DisplayName("should answer 401 with valid=false for a malformed token")
        void shouldRejectMalformedToken() {
            given().contentType(ContentType.JSON)
                    .body("{\"token\": \"not-a-jwt\"}")
                    .when()
                    .post("/auth/validate")
                    .then()
                    .statusCode(401)
                    .body("valid", equalTo(false))
                    .body("error", equalTo("malformed"));
        }

        @Test
        @DisplayName("should answer 400 when no token is presented")
        void shouldRequireToken() {
            given().contentType(ContentType.JSON)
                    .body("{}")
                    .when()
                    .post("/auth/validate")
                    .then()
                    .statusCode(400)
                    .contentType("application/problem+json");
        }

        @Test
        @DisplayName("should accept a live API key")
        void shouldAcceptApiKey() {
            register(source);
            final var key = createApiKey(source);

            given().contentType(ContentType.JSON)
                    .body("{\"token\": \"%s\"}".formatted(key))
                    .when()
                    .post("/auth/validate")
                    .then()
                    .statusCode(200)
                    .body("valid", equalTo(true))
                    .body("claims.client_id", equalTo(source));
        }
    }

    @Nested
    @DisplayName("POST /auth/validate with IP binding")
    class ValidateBoundToken {

        private static final String BOUND_IP = "203.0.113.7";

        private String issueBoundToken() {
            given().contentType(ContentType.JSON)
                    .body("{\"clientId\": \"%s\", \"ipBinding\": true}".formatted(target))
                    .when()
                    .post("/admin/apps")
                    .then()
                    .statusCode(201);
            final var principal = new VerifiedPrincipal("bob", "bob@example.com", "Bob", Set.of("Staff"));
            return tokens.issueUserToken(principal, target, new ClientContext(BOUND_IP, null))
                    .await()
                    .atMost(Duration.ofSeconds(5))
                    .accessToken()
                    .token();
        }

        @Test
        @DisplayName("should ignore X-Forwarded-For from a peer that is not a trusted proxy")
        void shouldIgnoreForwardedForFromUntrustedPeer() {
            final var token = issueBoundToken();

            given().contentType(ContentType.JSON)
                    .header("X-Forwarded-For", BOUND_IP)
                    .body("{\"token\": \"%s\", \"audience\": \"%s\"}".formatted(token, target))
                    .when()
                    .post("/auth/validate")
                    .then()
                    .statusCode(403)
                    .body("valid", equalTo(false))
                    .body("error", equalTo("ip_mismatch"));
        }

        @Test
        @DisplayName("should check the end-user IP passed by a resource server")
        void shouldUseRequestContextFromBody() {
            final var token = issueBoundToken();

            given().contentType(ContentType.JSON)
                    .body("{\"token\": \"%s\", \"audience\": \"%s\", \"ip\": \"%s\"}"
                            .formatted(token, target, BOUND_IP))
                    .when()
                    .post("/auth/validate")
                    .then()
                    .statusCode(200)
                    .body("valid", equalTo(true));

            given().contentType(ContentType.JSON)
                    .body("{\"token\": \"%s\", \"audience\": \"%s\", \"ip\": \"198.51.100.9\"}"
                            .formatted(token, target))
                    .when()
                    .post("/auth/validate")
                    .then()
                    .statusCode(403)
                    .body("error", equalTo("ip_mismatch"));
        }
    }

    @Nested
    @DisplayName("POST /auth/revoke")
    class Revoke {

        @Test
        @DisplayName("should accept unknown tokens silently")
        void shouldAcceptUnknownToken() {
            given().contentType(ContentType.JSON)
                    .body("{\"token\": \"never-issued\"}")
                    .when()
                    .post("/auth/revoke")
                    .then()
                    .statusCode(204);
        }

        @Test
        @DisplayName("should reject a request without token")
        void shouldRejectMissingToken() {
            given().contentType(ContentType.JSON)
                    .body("{}")
                    .when()
                    .post("/auth/revoke")
                    .then()
                    .statusCode(400);
        }
    }

    @Nested
    @DisplayName("POST /auth/token/refresh")
    class Refresh {

        @Test
        @DisplayName("should reject an unknown refresh token")
        void shouldRejectUnknownRefreshToken() {
            given().contentType(ContentType.JSON)
                    .body("{\"refresh_token\": \"never-issued\"}")
                    .when()
                    .post("/auth/token/refresh")
                    .then()
                    .statusCode(401)
                    .contentType("application/problem+json");
        }
    }

    @Nested
    @DisplayName("POST /auth/a2a/token")
    class ServiceToken {

        @Test
        @DisplayName("should issue a service token within the permitted scopes")
        void shouldIssueServiceToken() {
            register(source);
            register(target);
            final var key = createApiKey(source);
            allow("[\"orders.read\", \"orders.write\"]");

            final String token = given().contentType(ContentType.JSON)
                    .header("X-API-Key", key)
                    .body("""
                            {"target_client_id": "%s", "scopes": ["orders.read"], "duration": 600}
                            """.formatted(target))
                    .when()
                    .post("/auth/a2a/token")
                    .then()
                    .statusCode(200)
                    .body("token_type", equalTo("Bearer"))
                    .body("expires_in", equalTo(120))
                    .body("scope", equalTo("orders.read"))
                    .body("a2a_id", notNullValue())
                    .extract()
                    .path("access_token");

            given().contentType(ContentType.JSON)
                    .body("{\"token\": \"%s\", \"audience\": \"%s\"}".formatted(token, target))
                    .when()
                    .post("/auth/validate")
                    .then()
                    .statusCode(200)
                    .body("valid", equalTo(true));
        }

        @Test
        @DisplayName("should deny scopes outside the permission")
        void shouldDenyScopes() {
            register(source);
            register(target);
            final var key = createApiKey(source);
            allow("[\"orders.read\"]");

            given().contentType(ContentType.JSON)
                    .header("X-API-Key", key)
                    .body("""
                            {"target_client_id": "%s", "scopes": ["orders.read", "orders.delete"]}
                            """.formatted(target))
                    .when()
                    .post("/auth/a2a/token")
                    .then()
                    .statusCode(403)
                    .contentType("application/problem+json")
                    .body("error", equalTo("scope_denied"))
                    .body("deniedScopes", hasItem("orders.delete"));
        }

        @Test
        @DisplayName("should deny callers without a permission")
        void shouldDenyWithoutPermission() {
            register(source);
            register(target);
            final var key = createApiKey(source);

            given().contentType(ContentType.JSON)
                    .header("X-API-Key", key)
                    .body("{\"target_client_id\": \"%s\"}".formatted(target))
                    .when()
                    .post("/auth/a2a/token")
                    .then()
                    .statusCode(403)
                    .body("error", equalTo("no_permission"));
        }

        @Test
        @DisplayName("should reject an unknown API key")
        void shouldRejectUnknownKey() {
            given().contentType(ContentType.JSON)
                    .header("X-API-Key", "cids_ak_unknown")
                    .body("{\"target_client_id\": \"%s\"}".formatted(target))
                    .when()
                    .post("/auth/a2a/token")
                    .then()
                    .statusCode(401)
                    .contentType("application/problem+json")
                    .body("error", equalTo("invalid_api_key"));
        }

        @Test
        @DisplayName("should require an API key")
        void shouldRequireApiKey() {
            given().contentType(ContentType.JSON)
                    .body("{\"target_client_id\": \"%s\"}".formatted(target))
                    .when()
                    .post("/auth/a2a/token")
                    .then()
                    .statusCode(401);
        }
    }
}
