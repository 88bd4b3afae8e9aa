package cids.core.service.discovery;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.config.DiscoveryConfig;
import cids.core.model.activity.ActivityAction;
import cids.core.model.app.Application;
import cids.core.model.capability.PermissionTree;
import cids.core.model.common.EntityNotFoundException;
import cids.core.model.discovery.DiscoveryAttempt;
import cids.core.model.discovery.DiscoveryDiagnostic;
import cids.core.model.discovery.DiscoveryErrorType;
import cids.core.model.discovery.DiscoveryException;
import cids.core.model.discovery.DiscoveryResult;
import cids.core.model.discovery.DiscoveryStatistics;
import cids.core.model.discovery.DiscoveryStatus;
import cids.core.model.token.TokenType;
import cids.core.port.in.ApplicationManagement;
import cids.core.port.in.DiscoveryManagement;
import cids.core.port.in.RoleManagement;
import cids.core.port.out.CapabilityGraphRepository;
import cids.core.port.out.DiscoveryClient;
import cids.core.port.out.DiscoveryClient.DiscoveryResponse;
import cids.core.port.out.DiscoveryHistoryRepository;
import cids.core.port.out.Metrics;
import cids.core.service.activity.ActivityLogService;
import cids.core.service.token.TokenMinter;

/**
 * Pulls discovery documents from registered applications and publishes their
 * capability graphs.
 *
 * <p>Concurrent requests for the same application share one run. A failed run
 * leaves the published graph untouched.
 */
@ApplicationScoped
public class DiscoveryService implements DiscoveryManagement {

    private static final Logger LOG = Logger.getLogger(DiscoveryService.class);

    static final String SERVICE_SUBJECT = "cids-discovery-service";
    static final String USER_AGENT = "CIDS-Discovery/2.0";
    private static final Duration SERVICE_TOKEN_TTL = Duration.ofMinutes(5);

    private final ApplicationManagement applications;
    private final RoleManagement roles;
    private final CapabilityGraphRepository graphRepository;
    private final DiscoveryHistoryRepository historyRepository;
    private final DiscoveryClient client;
    private final DiscoveryDocumentParser parser;
    private final TokenMinter minter;
    private final ActivityLogService activityLog;
    private final DiscoveryConfig config;
    private final Metrics metrics;
    private final RetryPolicy retryPolicy;
    private final Map<String, Uni<DiscoveryResult>> inFlight = new ConcurrentHashMap<>();

    @Inject
    public DiscoveryService(
            ApplicationManagement applications,
            RoleManagement roles,
            CapabilityGraphRepository graphRepository,
            DiscoveryHistoryRepository historyRepository,
            DiscoveryClient client,
            DiscoveryDocumentParser parser,
            TokenMinter minter,
            ActivityLogService activityLog,
            DiscoveryConfig config,
            Metrics metrics) {
        this.applications = applications;
        this.roles = roles;
        this.graphRepository = graphRepository;
        this.historyRepository = historyRepository;
        this.client = client;
        this.parser = parser;
        this.minter = minter;
        this.activityLog = activityLog;
        this.config = config;
        this.metrics = metrics;
        this.retryPolicy = RetryPolicy.from(
                config.retry(), e -> e instanceof DiscoveryException de && de.isRetryable());
    }

    @Override
    public Uni<DiscoveryResult> discover(String clientId, boolean force) {
        return inFlight.computeIfAbsent(clientId, id -> run(id, force)
                .onTermination()
                .invoke(() -> inFlight.remove(id))
                .memoize()
                .indefinitely());
    }

    @Override
    public Uni<Map<String, DiscoveryResult>> batchDiscover(List<String> clientIds, boolean force) {
        final var ordered = new ArrayList<>(new LinkedHashSet<>(clientIds));
        if (ordered.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }
        return Multi.createFrom()
                .iterable(ordered)
                .onItem()
                .transformToUni(id -> discover(id, force)
                        .onFailure()
                        .recoverWithItem(e -> DiscoveryResult.error(
                                id,
                                List.of(DiscoveryDiagnostic.error(
                                        DiscoveryErrorType.CONFIGURATION_ERROR, e.getMessage(), 0)),
                                0,
                                Duration.ZERO)))
                .merge(Math.max(1, config.batchConcurrency()))
                .collect()
                .asList()
                .map(results -> {
                    final var byClient = new LinkedHashMap<String, DiscoveryResult>();
                    ordered.forEach(id -> results.stream()
                            .filter(r -> r.clientId().equals(id))
                            .findFirst()
                            .ifPresent(r -> byClient.put(id, r)));
                    return byClient;
                });
    }

    @Override
    public Uni<List<DiscoveryAttempt>> history(String clientId, int limit) {
        return historyRepository.findByClient(clientId, limit > 0 ? limit : config.historySize());
    }

    @Override
    public Uni<DiscoveryStatistics> statistics(String clientId) {
        return historyRepository
                .findByClient(clientId, config.historySize())
                .map(history -> DiscoveryStatistics.from(clientId, history));
    }

    @Override
    public Uni<Optional<PermissionTree>> permissionTree(String clientId) {
        return graphRepository.findByClient(clientId).map(graph -> graph.map(PermissionTree::of));
    }

    /**
     * Drop history older than the retention window.
     */
    @Scheduled(every = "1h", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> purgeHistory() {
        final var cutoff = Instant.now().minus(config.historyRetention());
        return historyRepository
                .purgeOlderThan(cutoff)
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infov("Purged {0} discovery history entries older than {1}", count, cutoff);
                    }
                })
                .replaceWithVoid();
    }

    private Uni<DiscoveryResult> run(String clientId, boolean force) {
        final var started = System.nanoTime();
        return applications
                .get(clientId)
                .flatMap(app -> {
                    if (app.isEmpty()) {
                        return Uni.createFrom().failure(new EntityNotFoundException("Application", clientId));
                    }
                    final var application = app.get();
                    final var problem = configurationProblem(application);
                    if (problem != null) {
                        final var result = DiscoveryResult.error(
                                clientId,
                                List.of(DiscoveryDiagnostic.error(DiscoveryErrorType.CONFIGURATION_ERROR, problem, 0)),
                                0,
                                elapsed(started));
                        return complete(result, force);
                    }
                    if (force) {
                        return fetchAndPublish(application, started, force);
                    }
                    return cached(clientId, started)
                            .flatMap(cached -> cached.isPresent()
                                    ? Uni.createFrom().item(cached.get())
                                    : fetchAndPublish(application, started, false));
                });
    }

    private static String configurationProblem(Application application) {
        if (!application.active()) {
            return "Application " + application.clientId() + " is inactive";
        }
        if (!application.allowDiscovery()) {
            return "Discovery is disabled for application " + application.clientId();
        }
        try {
            application.discoveryUri();
            return null;
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
    }

    private Uni<Optional<DiscoveryResult>> cached(String clientId, long started) {
        final var windowStart = Instant.now().minus(config.cacheWindow());
        return historyRepository
                .findLastSuccessful(clientId)
                .flatMap(last -> {
                    if (last.isEmpty() || last.get().timestamp().isBefore(windowStart)) {
                        return Uni.createFrom().item(Optional.<DiscoveryResult>empty());
                    }
                    return graphRepository
                            .findByClient(clientId)
                            .map(graph -> graph.map(g -> {
                                LOG.debugv("Reusing discovery of {0} from {1}", clientId, last.get().timestamp());
                                return new DiscoveryResult(
                                        clientId, DiscoveryStatus.CACHED, g, List.of(), 0, elapsed(started), null);
                            }));
                });
    }

    private Uni<DiscoveryResult> fetchAndPublish(Application application, long started, boolean force) {
        final var clientId = application.clientId();
        final var endpoint = application.discoveryUri();
        final var diagnostics = new CopyOnWriteArrayList<DiscoveryDiagnostic>();
        final var attempts = new AtomicInteger();

        return reachable(endpoint)
                .flatMap(reachable -> {
                    if (!reachable) {
                        diagnostics.add(DiscoveryDiagnostic.error(
                                DiscoveryErrorType.NETWORK_ERROR, "Discovery endpoint unreachable: " + endpoint, 0));
                        return complete(DiscoveryResult.error(clientId, diagnostics, 0, elapsed(started)), force);
                    }
                    return retryPolicy
                            .execute(
                                    number -> {
                                        attempts.set(number);
                                        return fetchOnce(application, endpoint);
                                    },
                                    (number, failure, nextDelay) -> {
                                        diagnostics.add(diagnostic(failure, number));
                                        if (nextDelay != null) {
                                            LOG.debugv(
                                                    "Discovery attempt {0} for {1} failed, retrying in {2}: {3}",
                                                    number, clientId, nextDelay, failure.getMessage());
                                        }
                                    })
                            .flatMap(parsed -> publish(clientId, parsed, diagnostics, attempts.get(), started))
                            .onFailure()
                            .recoverWithItem(failure -> {
                                if (diagnostics.isEmpty()) {
                                    diagnostics.add(diagnostic(failure, attempts.get()));
                                }
                                return DiscoveryResult.error(clientId, diagnostics, attempts.get(), elapsed(started));
                            })
                            .flatMap(result -> complete(result, force));
                });
    }

    private Uni<Boolean> reachable(URI endpoint) {
        if (!config.reachabilityCheckEnabled()) {
            return Uni.createFrom().item(true);
        }
        return client.checkReachable(endpoint, config.reachabilityTimeout())
                .map(status -> true)
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.debugv("Reachability check of {0} failed: {1}", endpoint, e.getMessage());
                    return false;
                });
    }

    private Uni<DiscoveryDocumentParser.ParsedDocument> fetchOnce(Application application, URI endpoint) {
        final Map<String, String> headers;
        try {
            headers = headers(application);
        } catch (RuntimeException e) {
            return Uni.createFrom()
                    .failure(new DiscoveryException(
                            DiscoveryErrorType.CONFIGURATION_ERROR,
                            "Unable to sign discovery request: " + e.getMessage(),
                            e));
        }
        return client.fetch(withVersion(endpoint), headers, config.fetchTimeout(), config.maxResponseBytes())
                .map(response -> {
                    checkStatus(response);
                    return parser.parse(application.clientId(), response.body(), config.schemaVersion());
                });
    }

    private Map<String, String> headers(Application application) {
        final var headers = new LinkedHashMap<String, String>();
        headers.put("Accept", "application/json");
        headers.put("User-Agent", USER_AGENT);
        headers.put("X-Discovery-Version", config.schemaVersion());
        if (config.authenticateRequests()) {
            final var token = minter.mint(
                    TokenType.SERVICE, SERVICE_SUBJECT, application.clientId(), SERVICE_TOKEN_TTL, claims -> {
                        claims.setStringListClaim("scopes", List.of("discovery"));
                        claims.setStringClaim("scope", "discovery");
                    });
            headers.put("Authorization", "Bearer " + token.token());
        }
        return headers;
    }

    private URI withVersion(URI endpoint) {
        final var query = "version=" + config.schemaVersion();
        final var raw = endpoint.toString();
        if (endpoint.getRawQuery() == null) {
            return URI.create(raw + "?" + query);
        }
        return URI.create(raw + "&" + query);
    }

    private static void checkStatus(DiscoveryResponse response) {
        final int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        if (status == 401 || status == 403) {
            throw new DiscoveryException(
                    DiscoveryErrorType.AUTHENTICATION_ERROR, "Discovery endpoint rejected credentials: HTTP " + status);
        }
        if (status >= 500 || status == 429) {
            throw new DiscoveryException(DiscoveryErrorType.SERVER_ERROR, "Discovery endpoint failed: HTTP " + status);
        }
        throw new DiscoveryException(
                DiscoveryErrorType.CONFIGURATION_ERROR, "Discovery endpoint answered HTTP " + status);
    }

    private Uni<DiscoveryResult> publish(
            String clientId,
            DiscoveryDocumentParser.ParsedDocument parsed,
            List<DiscoveryDiagnostic> diagnostics,
            int attempts,
            long started) {
        parsed.warnings().forEach(w -> diagnostics.add(DiscoveryDiagnostic.warning(w)));
        return graphRepository
                .publish(parsed.graph())
                .flatMap(graph -> roles.staleGrants(clientId)
                        .onFailure()
                        .recoverWithItem(e -> {
                            LOG.warnv(e, "Unable to check grants of {0} against the new graph", clientId);
                            return List.of();
                        })
                        .map(stale -> {
                            stale.forEach(s -> diagnostics.add(DiscoveryDiagnostic.warning("Stale grant: " + s)));
                            final var hasWarnings = diagnostics.stream()
                                    .anyMatch(d -> d.severity() == DiscoveryDiagnostic.Severity.WARNING);
                            return new DiscoveryResult(
                                    clientId,
                                    hasWarnings ? DiscoveryStatus.PARTIAL : DiscoveryStatus.SUCCESS,
                                    graph,
                                    diagnostics,
                                    attempts,
                                    elapsed(started),
                                    null);
                        }));
    }

    private Uni<DiscoveryResult> complete(DiscoveryResult result, boolean force) {
        metrics.recordDiscovery(result.clientId(), result.status(), result.attempts(), result.latency());
        if (result.isSuccessful()) {
            LOG.infov(
                    "Discovered {0}: status={1}, version={2}, endpoints={3}, attempts={4}",
                    result.clientId(),
                    result.status(),
                    result.graph().version(),
                    result.graph().endpoints().size(),
                    result.attempts());
        } else {
            LOG.warnv(
                    "Discovery of {0} failed after {1} attempt(s): {2}",
                    result.clientId(),
                    result.attempts(),
                    result.diagnostics().isEmpty()
                            ? "unknown"
                            : result.diagnostics().get(result.diagnostics().size() - 1).message());
        }
        final var details = new LinkedHashMap<String, String>();
        details.put("status", result.status().name());
        details.put("attempts", Integer.toString(result.attempts()));
        result.errorType().ifPresent(t -> details.put("error_type", t.name()));
        if (result.graph() != null) {
            details.put("graph_version", Long.toString(result.graph().version()));
        }
        return historyRepository
                .append(DiscoveryAttempt.from(result, force), config.historySize())
                .onFailure()
                .recoverWithUni(e -> {
                    LOG.warnv(e, "Failed to record discovery history for {0}", result.clientId());
                    return Uni.createFrom().voidItem();
                })
                .call(() -> activityLog.record(
                        ActivityAction.DISCOVERY_COMPLETED, SERVICE_SUBJECT, result.clientId(), null, null, details))
                .replaceWith(result);
    }

    private static DiscoveryDiagnostic diagnostic(Throwable failure, int attempt) {
        if (failure instanceof DiscoveryException de) {
            return DiscoveryDiagnostic.error(de.errorType(), de.getMessage(), attempt);
        }
        return DiscoveryDiagnostic.error(
                DiscoveryErrorType.CONFIGURATION_ERROR, String.valueOf(failure.getMessage()), attempt);
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
