package cids;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.matching;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import java.util.UUID;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@QuarkusTest
@DisplayName("Discovery Integration Tests")
class DiscoveryIntegrationTest {

    private WireMockServer appServer;
    private String clientId;

    @BeforeEach
    void setUp() {
        appServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        appServer.start();
        clientId = "hr-" + UUID.randomUUID().toString().substring(0, 8);
        given().contentType(ContentType.JSON)
                .body("""
                        {"clientId": "%s", "discoveryEndpoint": "http://localhost:%d/discovery"}
                        """.formatted(clientId, appServer.port()))
                .when()
                .post("/admin/apps")
                .then()
                .statusCode(201);
    }

    @AfterEach
    void tearDown() {
        if (appServer != null) {
            appServer.stop();
        }
    }

    private String document() {
        return """
                {
                  "app_id": "%s",
                  "app_name": "HR",
                  "version": "2.0",
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
                }
                """.formatted(clientId);
    }

    private void serve(int status, String body) {
        appServer.stubFor(get(urlPathEqualTo("/discovery"))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    @Nested
    @DisplayName("Successful discovery")
    class Success {

        @Test
        @DisplayName("should publish the capability graph and expose its permissions")
        void shouldPublishGraph() {
            serve(200, document());

            given().when()
                    .post("/admin/discovery/" + clientId)
                    .then()
                    .statusCode(200)
                    .body("status", is("SUCCESS"))
                    .body("graph.version", is(1));

            appServer.verify(getRequestedFor(urlPathEqualTo("/discovery"))
                    .withQueryParam("version", equalTo("2.0"))
                    .withHeader("Authorization", matching("Bearer .+")));

            given().when()
                    .get("/admin/discovery/" + clientId + "/permissions/search?sensitiveOnly=true")
                    .then()
                    .statusCode(200)
                    .body("$", hasItem("employees.read.email"))
                    .body("$", hasItem("employees.read.pii"))
                    .body("$", not(hasItem("employees.read.id")));
        }

        @Test
        @DisplayName("should accept roles granting discovered capabilities")
        void shouldAcceptGrantsAfterDiscovery() {
            serve(200, document());
            given().when().post("/admin/discovery/" + clientId).then().statusCode(200);

            given().contentType(ContentType.JSON)
                    .body("{\"name\": \"viewer\", \"grants\": [\"employees.read.pii\"]}")
                    .when()
                    .post("/admin/apps/" + clientId + "/roles")
                    .then()
                    .statusCode(201);

            given().contentType(ContentType.JSON)
                    .body("{\"name\": \"editor\", \"grants\": [\"payroll.update\"]}")
                    .when()
                    .post("/admin/apps/" + clientId + "/roles")
                    .then()
                    .statusCode(400);
        }
    }

    @Nested
    @DisplayName("Failed discovery")
    class Failure {

        @Test
        @DisplayName("should report a validation error for a mismatched app_id")
        void shouldRejectMismatchedAppId() {
            serve(200, document().replace(clientId, "someone-else"));

            given().when()
                    .post("/admin/discovery/" + clientId)
                    .then()
                    .statusCode(200)
                    .body("status", is("ERROR"));

            given().when()
                    .get("/admin/discovery/" + clientId + "/permissions")
                    .then()
                    .statusCode(404);
        }

        @Test
        @DisplayName("should classify a slow endpoint as a timeout and retry it up to the attempt limit")
        void shouldRetryTimeouts() {
            appServer.stubFor(get(urlPathEqualTo("/discovery"))
                    .willReturn(aResponse().withStatus(200).withBody(document()).withFixedDelay(3_000)));

            given().when()
                    .post("/admin/discovery/" + clientId)
                    .then()
                    .statusCode(200)
                    .body("status", is("ERROR"))
                    .body("attempts", is(3))
                    .body("diagnostics.last().errorType", is("TIMEOUT_ERROR"));

            appServer.verify(3, getRequestedFor(urlPathEqualTo("/discovery")));
        }

        @Test
        @DisplayName("should reject a streamed body over the size ceiling without retrying")
        void shouldRejectOversizedChunkedBody() {
            appServer.stubFor(get(urlPathEqualTo("/discovery"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"padding\": \"" + "x".repeat(20_000) + "\"}")
                            .withChunkedDribbleDelay(5, 200)));

            given().when()
                    .post("/admin/discovery/" + clientId)
                    .then()
                    .statusCode(200)
                    .body("status", is("ERROR"))
                    .body("diagnostics.last().errorType", is("VALIDATION_ERROR"));

            appServer.verify(1, getRequestedFor(urlPathEqualTo("/discovery")));
        }

        @Test
        @DisplayName("should not retry rejected credentials")
        void shouldNotRetryAuthenticationErrors() {
            serve(401, "{}");

            given().when()
                    .post("/admin/discovery/" + clientId)
                    .then()
                    .statusCode(200)
                    .body("status", is("ERROR"))
                    .body("attempts", is(1))
                    .body("diagnostics.last().errorType", is("AUTHENTICATION_ERROR"));

            appServer.verify(1, getRequestedFor(urlPathEqualTo("/discovery")));
        }

        @Test
        @DisplayName("should record failed attempts in the history")
        void shouldRecordHistory() {
            serve(503, "{}");

            given().when()
                    .post("/admin/discovery/" + clientId)
                    .then()
                    .statusCode(200)
                    .body("status", is("ERROR"));

            given().when()
                    .get("/admin/discovery/" + clientId + "/statistics")
                    .then()
                    .statusCode(200)
                    .body("successes", is(0));
        }
    }
}
