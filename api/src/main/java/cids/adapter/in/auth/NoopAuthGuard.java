package cids.adapter.in.auth;

import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.StartupEvent;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

/**
 * Owns the {@code cids.auth.dangerous-noop} switch.
 *
 * <p>Startup fails if the switch is on in production mode.
 */
@ApplicationScoped
public class NoopAuthGuard {

    private static final Logger LOG = Logger.getLogger(NoopAuthGuard.class);
    static final String PROPERTY = "cids.auth.dangerous-noop";

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);

    /**
     * @throws IllegalStateException if dangerous-noop is enabled in production
     */
    void onStart(@Observes StartupEvent event) {
        if (!isDangerousNoopEnabled()) {
            return;
        }
        if (currentLaunchMode() == LaunchMode.NORMAL) {
            LOG.error(PROPERTY + "=true is not allowed in production mode");
            throw new IllegalStateException(PROPERTY + "=true is not allowed in production mode. "
                    + "This setting disables admin authentication. "
                    + "Remove this setting or run in dev/test mode.");
        }
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("DANGEROUS: admin authentication is DISABLED (" + PROPERTY + "=true)");
        }
    }

    /**
     * Reads the config at call time so test profiles can override it.
     */
    public boolean isDangerousNoopEnabled() {
        return ConfigProvider.getConfig()
                .getOptionalValue(PROPERTY, Boolean.class)
                .orElse(false);
    }

    LaunchMode currentLaunchMode() {
        return LaunchMode.current();
    }
}
