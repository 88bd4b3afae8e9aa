package cids.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import cids.core.model.token.TokenIssuanceException;
import cids.core.service.key.SigningKeyRegistry;

/**
 * Readiness check for token signing.
 *
 * <p>DOWN until the key registry holds an active signing key. Tokens cannot be
 * issued before that, so the instance should not receive traffic.
 */
@Readiness
@ApplicationScoped
public class SigningKeyHealthCheck implements HealthCheck {

    private final SigningKeyRegistry keyRegistry;

    @Inject
    public SigningKeyHealthCheck(SigningKeyRegistry keyRegistry) {
        this.keyRegistry = keyRegistry;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("signing-keys");
        builder.withData("verification.keys", keyRegistry.getVerificationKeys().size());
        keyRegistry.getLastRefreshTime().ifPresent(t -> builder.withData("last.refresh", t.toString()));

        if (!keyRegistry.isReady()) {
            return builder.down().build();
        }
        try {
            builder.withData("active.key", keyRegistry.getCurrentSigningKey().keyId());
        } catch (TokenIssuanceException e) {
            return builder.withData("error", e.getMessage()).down().build();
        }
        return builder.up().build();
    }
}
