package cids.core.port.out;

import java.time.Duration;

import cids.core.model.discovery.DiscoveryStatus;
import cids.core.model.token.TokenType;
import cids.core.model.token.ValidationFailure;

/**
 * Operational metrics of the broker.
 */
public interface Metrics {

    void recordTokenIssued(TokenType type, String clientId);

    void recordValidation(ValidationFailure failure);

    void recordDiscovery(String clientId, DiscoveryStatus status, int attempts, Duration latency);

    void recordA2ADenied(String reason);

    void recordRefreshReuse(String clientId);
}
