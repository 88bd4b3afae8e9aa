package cids.adapter.in.auth;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.StringPermission;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusPrincipal;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import cids.core.config.TokenConfig;
import cids.core.model.token.TokenValidationResult;
import cids.core.model.token.ValidationContext;
import cids.core.port.in.TokenManagement;

/**
 * Turns a broker-issued token into a security identity.
 *
 * <p>The token must be valid for the internal audience. Its {@code permissions}
 * claim becomes the identity's {@link StringPermission}s, so {@code cids.admin}
 * unlocks the admin resources.
 */
@ApplicationScoped
public class BrokerIdentityProvider implements IdentityProvider<BrokerAuthenticationRequest> {

    private static final Logger LOG = Logger.getLogger(BrokerIdentityProvider.class);
    static final String NOOP_PRINCIPAL = "Development Mode";

    private final TokenManagement tokens;
    private final TokenConfig tokenConfig;

    @Inject
    public BrokerIdentityProvider(TokenManagement tokens, TokenConfig tokenConfig) {
        this.tokens = tokens;
        this.tokenConfig = tokenConfig;
    }

    @Override
    public Class<BrokerAuthenticationRequest> getRequestType() {
        return BrokerAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            BrokerAuthenticationRequest request, AuthenticationRequestContext context) {
        if (request.isNoop()) {
            return Uni.createFrom().item(identity(NOOP_PRINCIPAL, Set.of(BrokerPermission.ADMIN)));
        }
        return tokens.validate(request.getToken(), ValidationContext.forAudience(tokenConfig.internalAudience()))
                .map(result -> {
                    if (result instanceof TokenValidationResult.Valid valid) {
                        final var permissions = permissions(valid.claims().get("permissions"));
                        LOG.debugv("Authenticated {0} with {1} permission(s)", valid.subject(), permissions.size());
                        return identity(valid.subject(), permissions);
                    }
                    final var invalid = (TokenValidationResult.Invalid) result;
                    throw new AuthenticationFailedException(invalid.failure().name() + ": " + invalid.detail());
                });
    }

    private static Set<String> permissions(Object claim) {
        final var permissions = new LinkedHashSet<String>();
        if (claim instanceof Collection<?> values) {
            values.forEach(v -> permissions.add(String.valueOf(v)));
        }
        return permissions;
    }

    private static SecurityIdentity identity(String subject, Set<String> permissions) {
        final var builder = QuarkusSecurityIdentity.builder()
                .setPrincipal(new QuarkusPrincipal(subject))
                .addAttribute("permissions", permissions);
        permissions.forEach(p -> builder.addPermission(new StringPermission(p)));
        return builder.build();
    }
}
