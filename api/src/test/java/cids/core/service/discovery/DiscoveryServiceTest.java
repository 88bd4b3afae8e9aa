package cids.core.service.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import cids.adapter.out.storage.memory.InMemoryActivityLogRepository;
import cids.adapter.out.storage.memory.InMemoryCapabilityGraphRepository;
import cids.adapter.out.storage.memory.InMemoryDiscoveryHistoryRepository;
import cids.core.config.ActivityLogConfig;
import cids.core.config.DiscoveryConfig;
import cids.core.model.app.Application;
import cids.core.model.common.EntityNotFoundException;
import cids.core.model.discovery.DiscoveryErrorType;
import cids.core.model.discovery.DiscoveryException;
import cids.core.model.discovery.DiscoveryStatus;
import cids.core.port.in.ApplicationManagement;
import cids.core.port.in.RoleManagement;
import cids.core.port.out.DiscoveryClient;
import cids.core.port.out.DiscoveryClient.DiscoveryResponse;
import cids.core.port.out.Metrics;
import cids.core.service.activity.ActivityLogService;
import cids.core.service.token.TokenMinter;

@DisplayName("DiscoveryService")
class DiscoveryServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);
    private static final String CLIENT = "hr-app";

    private static final String DOCUMENT = """
            {
              "app_id": "hr-app",
              "app_name": "HR",
              "version": "2.0",
              "last_updated": "2024-03-01T10:00:00Z",
              "endpoints": [
                {"method": "GET", "path": "/api/employees", "resource": "employees", "action": "read"}
              ],
              "response_fields": {"employees": {"id": {"category": "base"}}}
            }
            """;

    private ApplicationManagement applications;
    private RoleManagement roles;
    private DiscoveryClient client;
    private Metrics metrics;
    private InMemoryCapabilityGraphRepository graphs;
    private InMemoryDiscoveryHistoryRepository history;
    private DiscoveryService service;

    @BeforeEach
    void setUp() {
        applications = mock(ApplicationManagement.class);
        roles = mock(RoleManagement.class);
        client = mock(DiscoveryClient.class);
        metrics = mock(Metrics.class);
        graphs = new InMemoryCapabilityGraphRepository();
        history = new InMemoryDiscoveryHistoryRepository();

        final var config = mock(DiscoveryConfig.class);
        final var retry = mock(DiscoveryConfig.RetryConfig.class);
        when(config.retry()).thenReturn(retry);
        when(retry.maxAttempts()).thenReturn(3);
        when(retry.baseDelay()).thenReturn(Duration.ofMillis(5));
        when(retry.multiplier()).thenReturn(2.0);
        when(retry.maxDelay()).thenReturn(Duration.ofMillis(20));
        when(retry.jitterFactor()).thenReturn(0.0);
        when(config.schemaVersion()).thenReturn("2.0");
        when(config.reachabilityCheckEnabled()).thenReturn(false);
        when(config.fetchTimeout()).thenReturn(Duration.ofSeconds(1));
        when(config.maxResponseBytes()).thenReturn(1024L * 1024);
        when(config.cacheWindow()).thenReturn(Duration.ofMinutes(60));
        when(config.historySize()).thenReturn(10);
        when(config.batchConcurrency()).thenReturn(2);
        when(config.authenticateRequests()).thenReturn(false);

        final var activityConfig = mock(ActivityLogConfig.class);
        final var activityLog = new ActivityLogService(new InMemoryActivityLogRepository(100), activityConfig);

        when(roles.staleGrants(anyString())).thenReturn(Uni.createFrom().item(List.of()));
        registered(CLIENT, "https://hr.example.com/discovery");

        service = new DiscoveryService(
                applications,
                roles,
                graphs,
                history,
                client,
                new DiscoveryDocumentParser(new ObjectMapper()),
                mock(TokenMinter.class),
                activityLog,
                config,
                metrics);
    }

    private void registered(String clientId, String endpoint) {
        final var app = Application.builder(clientId).discoveryEndpoint(endpoint).build();
        when(applications.get(clientId)).thenReturn(Uni.createFrom().item(Optional.of(app)));
    }

    private void responds(Uni<DiscoveryResponse> response) {
        when(client.fetch(any(URI.class), anyMap(), any(Duration.class), anyLong()))
                .thenReturn(response);
    }

    @Nested
    @DisplayName("discover()")
    class Discover {

        @Test
        @DisplayName("should publish the graph and record history on success")
        void shouldPublishGraph() {
            responds(Uni.createFrom().item(new DiscoveryResponse(200, DOCUMENT)));

            final var result = service.discover(CLIENT, false).await().atMost(TIMEOUT);

            assertEquals(DiscoveryStatus.SUCCESS, result.status());
            assertEquals(1L, result.graph().version());
            assertEquals(1, result.attempts());
            assertTrue(graphs.findByClient(CLIENT).await().atMost(TIMEOUT).isPresent());
            assertEquals(1, service.history(CLIENT, 0).await().atMost(TIMEOUT).size());
            verify(metrics).recordDiscovery(CLIENT, DiscoveryStatus.SUCCESS, 1, result.latency());
        }

        @Test
        @DisplayName("should append the schema version to the request URL")
        void shouldAppendVersion() {
            responds(Uni.createFrom().item(new DiscoveryResponse(200, DOCUMENT)));

            service.discover(CLIENT, true).await().atMost(TIMEOUT);

            verify(client)
                    .fetch(
                            eq(URI.create("https://hr.example.com/discovery?version=2.0")),
                            anyMap(),
                            any(Duration.class),
                            anyLong());
        }

        @Test
        @DisplayName("should reuse a recent success unless forced")
        void shouldReuseCachedResult() {
            responds(Uni.createFrom().item(new DiscoveryResponse(200, DOCUMENT)));
            service.discover(CLIENT, false).await().atMost(TIMEOUT);

            final var cached = service.discover(CLIENT, false).await().atMost(TIMEOUT);
            final var forced = service.discover(CLIENT, true).await().atMost(TIMEOUT);

            assertEquals(DiscoveryStatus.CACHED, cached.status());
            assertEquals(1L, cached.graph().version());
            assertEquals(DiscoveryStatus.SUCCESS, forced.status());
            assertEquals(2L, forced.graph().version());
            verify(client, times(2)).fetch(any(URI.class), anyMap(), any(Duration.class), anyLong());
        }

        @Test
        @DisplayName("should retry server errors and report every failed attempt")
        void shouldRetryServerErrors() {
            final var calls = new AtomicInteger();
            responds(Uni.createFrom().item(() -> calls.incrementAndGet() < 3
                    ? new DiscoveryResponse(503, "")
                    : new DiscoveryResponse(200, DOCUMENT)));

            final var result = service.discover(CLIENT, true).await().atMost(TIMEOUT);

            assertEquals(DiscoveryStatus.SUCCESS, result.status());
            assertEquals(3, result.attempts());
            assertEquals(2, result.diagnostics().size());
            assertEquals(DiscoveryErrorType.SERVER_ERROR, result.diagnostics().get(0).errorType());
        }

        @Test
        @DisplayName("should not retry authentication failures")
        void shouldNotRetryAuthFailures() {
            responds(Uni.createFrom().item(new DiscoveryResponse(401, "")));

            final var result = service.discover(CLIENT, true).await().atMost(TIMEOUT);

            assertEquals(DiscoveryStatus.ERROR, result.status());
            assertEquals(1, result.attempts());
            assertEquals(Optional.of(DiscoveryErrorType.AUTHENTICATION_ERROR), result.errorType());
            assertNull(result.graph());
        }

        @Test
        @DisplayName("should keep the previous graph when a later run fails")
        void shouldKeepPreviousGraphOnFailure() {
            responds(Uni.createFrom().item(new DiscoveryResponse(200, DOCUMENT)));
            service.discover(CLIENT, false).await().atMost(TIMEOUT);

            responds(Uni.createFrom().item(new DiscoveryResponse(200, "{\"app_id\": \"hr-app\"}")));
            final var result = service.discover(CLIENT, true).await().atMost(TIMEOUT);

            assertEquals(DiscoveryStatus.ERROR, result.status());
            assertEquals(Optional.of(DiscoveryErrorType.VALIDATION_ERROR), result.errorType());
            assertEquals(
                    1L, graphs.findByClient(CLIENT).await().atMost(TIMEOUT).orElseThrow().version());
        }

        @Test
        @DisplayName("should report stale grants as a partial success")
        void shouldReportPartial() {
            responds(Uni.createFrom().item(new DiscoveryResponse(200, DOCUMENT)));
            when(roles.staleGrants(CLIENT)).thenReturn(Uni.createFrom().item(List.of("viewer:payroll.read")));

            final var result = service.discover(CLIENT, true).await().atMost(TIMEOUT);

            assertEquals(DiscoveryStatus.PARTIAL, result.status());
            assertTrue(result.diagnostics().get(0).message().contains("viewer:payroll.read"));
        }

        @Test
        @DisplayName("should fail with a configuration error when discovery is disabled")
        void shouldRejectDisabledDiscovery() {
            final var app = Application.builder("no-disc")
                    .discoveryEndpoint("https://x.example.com/d")
                    .allowDiscovery(false)
                    .build();
            when(applications.get("no-disc")).thenReturn(Uni.createFrom().item(Optional.of(app)));

            final var result = service.discover("no-disc", true).await().atMost(TIMEOUT);

            assertEquals(Optional.of(DiscoveryErrorType.CONFIGURATION_ERROR), result.errorType());
            verify(client, never()).fetch(any(URI.class), anyMap(), any(Duration.class), anyLong());
        }

        @Test
        @DisplayName("should fail for unknown applications")
        void shouldFailForUnknownApplication() {
            when(applications.get("ghost")).thenReturn(Uni.createFrom().item(Optional.empty()));

            assertThrows(
                    EntityNotFoundException.class,
                    () -> service.discover("ghost", false).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should share one run between concurrent callers")
        void shouldCoalesceConcurrentRuns() {
            responds(Uni.createFrom()
                    .item(new DiscoveryResponse(200, DOCUMENT))
                    .onItem()
                    .delayIt()
                    .by(Duration.ofMillis(100)));

            final var first = service.discover(CLIENT, true);
            final var second = service.discover(CLIENT, true);

            assertSame(first, second);
            first.await().atMost(TIMEOUT);
            verify(client, times(1)).fetch(any(URI.class), anyMap(), any(Duration.class), anyLong());
        }
    }

    @Nested
    @DisplayName("batchDiscover()")
    class BatchDiscover {

        @Test
        @DisplayName("should return one result per distinct client in request order")
        void shouldDiscoverEachClient() {
            registered("billing", "https://billing.example.com/discovery");
            when(client.fetch(any(URI.class), anyMap(), any(Duration.class), anyLong()))
                    .thenAnswer(invocation -> {
                        final URI uri = invocation.getArgument(0);
                        return uri.getHost().startsWith("hr")
                                ? Uni.createFrom().item(new DiscoveryResponse(200, DOCUMENT))
                                : Uni.createFrom()
                                        .failure(new DiscoveryException(DiscoveryErrorType.NETWORK_ERROR, "refused"));
                    });
            when(applications.get("ghost")).thenReturn(Uni.createFrom().item(Optional.empty()));

            final var results = service.batchDiscover(List.of("billing", CLIENT, "billing", "ghost"), true)
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(List.of("billing", CLIENT, "ghost"), List.copyOf(results.keySet()));
            assertEquals(DiscoveryStatus.ERROR, results.get("billing").status());
            assertEquals(3, results.get("billing").attempts());
            assertEquals(DiscoveryStatus.SUCCESS, results.get(CLIENT).status());
            assertEquals(DiscoveryStatus.ERROR, results.get("ghost").status());
        }
    }

    @Nested
    @DisplayName("statistics()")
    class Statistics {

        @Test
        @DisplayName("should summarize recorded runs")
        void shouldSummarizeHistory() {
            responds(Uni.createFrom().item(new DiscoveryResponse(200, DOCUMENT)));
            service.discover(CLIENT, true).await().atMost(TIMEOUT);
            responds(Uni.createFrom().item(new DiscoveryResponse(500, "")));
            service.discover(CLIENT, true).await().atMost(TIMEOUT);

            final var stats = service.statistics(CLIENT).await().atMost(TIMEOUT);

            assertEquals(2, stats.totalAttempts());
            assertEquals(1, stats.successes());
            assertEquals(DiscoveryErrorType.SERVER_ERROR, stats.lastErrorType());
        }
    }
}
