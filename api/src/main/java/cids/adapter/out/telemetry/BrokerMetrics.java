package cids.adapter.out.telemetry;

import java.time.Duration;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import cids.core.model.discovery.DiscoveryStatus;
import cids.core.model.token.TokenType;
import cids.core.model.token.ValidationFailure;
import cids.core.port.out.Metrics;

/**
 * Micrometer implementation of the broker metrics.
 *
 * <p>All methods are no-ops when metrics are disabled.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code cids.tokens.issued} - tokens issued by type and audience</li>
 *   <li>{@code cids.tokens.validations} - validation outcomes by failure reason</li>
 *   <li>{@code cids.tokens.refresh.reuse} - refresh token reuse detections</li>
 *   <li>{@code cids.a2a.denied} - denied service token requests by reason</li>
 *   <li>{@code cids.discovery.runs} - discovery outcomes by application and status</li>
 *   <li>{@code cids.discovery.latency} - discovery wall time</li>
 *   <li>{@code cids.discovery.attempts} - fetch attempts per discovery</li>
 * </ul>
 */
@ApplicationScoped
public class BrokerMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public BrokerMetrics(
            MeterRegistry registry, @ConfigProperty(name = "cids.metrics.enabled", defaultValue = "true") boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public void recordTokenIssued(TokenType type, String clientId) {
        if (!enabled) {
            return;
        }
        Counter.builder("cids.tokens.issued")
                .description("Tokens issued")
                .tag("token_type", type.claimValue())
                .tag("client_id", nullSafe(clientId))
                .register(registry)
                .increment();
    }

    @Override
    public void recordValidation(ValidationFailure failure) {
        if (!enabled) {
            return;
        }
        Counter.builder("cids.tokens.validations")
                .description("Credential validations by outcome")
                .tag("outcome", failure == null ? "valid" : "invalid")
                .tag("reason", failure == null ? "none" : failure.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void recordDiscovery(String clientId, DiscoveryStatus status, int attempts, Duration latency) {
        if (!enabled) {
            return;
        }
        final var app = nullSafe(clientId);
        final var outcome = status.name().toLowerCase(Locale.ROOT);
        Counter.builder("cids.discovery.runs")
                .description("Discovery runs by outcome")
                .tag("client_id", app)
                .tag("status", outcome)
                .register(registry)
                .increment();
        Timer.builder("cids.discovery.latency")
                .description("Wall time of a discovery run")
                .tag("client_id", app)
                .tag("status", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(latency);
        DistributionSummary.builder("cids.discovery.attempts")
                .description("Fetch attempts per discovery run")
                .tag("client_id", app)
                .register(registry)
                .record(attempts);
    }

    @Override
    public void recordA2ADenied(String reason) {
        if (!enabled) {
            return;
        }
        Counter.builder("cids.a2a.denied")
                .description("Denied service token requests")
                .tag("reason", nullSafe(reason).toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRefreshReuse(String clientId) {
        if (!enabled) {
            return;
        }
        Counter.builder("cids.tokens.refresh.reuse")
                .description("Refresh token reuse detections")
                .tag("client_id", nullSafe(clientId))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value == null ? "unknown" : value;
    }
}
