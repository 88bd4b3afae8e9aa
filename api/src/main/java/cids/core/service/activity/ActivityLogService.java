package cids.core.service.activity;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.config.ActivityLogConfig;
import cids.core.model.activity.ActivityAction;
import cids.core.model.activity.ActivityEntry;
import cids.core.model.activity.ActivityQuery;
import cids.core.model.token.TokenType;
import cids.core.port.out.ActivityLogRepository;

/**
 * Append-only audit trail of token and discovery events.
 *
 * <p>A failed write is logged and does not fail the operation being audited.
 */
@ApplicationScoped
public class ActivityLogService {

    private static final Logger LOG = Logger.getLogger(ActivityLogService.class);

    private final ActivityLogRepository repository;
    private final ActivityLogConfig config;

    @Inject
    public ActivityLogService(ActivityLogRepository repository, ActivityLogConfig config) {
        this.repository = repository;
        this.config = config;
    }

    public Uni<Void> record(ActivityAction action, String subject, String clientId, TokenType tokenType, String jti) {
        return record(action, subject, clientId, tokenType, jti, Map.of());
    }

    public Uni<Void> record(
            ActivityAction action,
            String subject,
            String clientId,
            TokenType tokenType,
            String jti,
            Map<String, String> details) {
        final var entry = new ActivityEntry(
                UUID.randomUUID().toString(), action, subject, clientId, tokenType, jti, Instant.now(), details);
        LOG.debugv("Activity {0}: subject={1}, client={2}, jti={3}", action.value(), subject, clientId, jti);
        return repository
                .append(entry)
                .onFailure()
                .recoverWithUni(e -> {
                    LOG.warnv(e, "Failed to record activity {0} for {1}", action.value(), subject);
                    return Uni.createFrom().voidItem();
                });
    }

    /**
     * Record a successful validation, when enabled.
     */
    public Uni<Void> recordValidation(String subject, String clientId, TokenType tokenType, String jti) {
        if (!config.logValidations()) {
            return Uni.createFrom().voidItem();
        }
        return record(ActivityAction.TOKEN_VALIDATED, subject, clientId, tokenType, jti);
    }

    public Uni<List<ActivityEntry>> query(ActivityQuery query) {
        return repository.query(query);
    }
}
