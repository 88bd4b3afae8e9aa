package cids.core.port.in;

import java.net.URI;

import io.smallrye.mutiny.Uni;

import cids.core.model.token.ClientContext;
import cids.core.model.token.TokenPair;
import cids.core.model.token.TokenValidationResult;
import cids.core.model.token.ValidationContext;
import cids.core.model.token.VerifiedPrincipal;

/**
 * Use cases for user login, token issuance, refresh, validation and revocation.
 */
public interface TokenManagement {

    /**
     * Identity provider URL starting a login for an application.
     */
    Uni<URI> loginUrl(String clientId, String redirectUri, String state);

    /**
     * Complete a login: exchange the provider's code and issue tokens.
     *
     * @param clientSecret the application's secret, required when it has one
     */
    Uni<TokenPair> exchangeCode(
            String clientId, String code, String redirectUri, String clientSecret, ClientContext context);

    Uni<TokenPair> issueUserToken(VerifiedPrincipal principal, String clientId, ClientContext context);

    /**
     * Exchange a refresh token for a new token pair. The presented token becomes unusable.
     */
    Uni<TokenPair> refresh(String refreshToken, ClientContext context);

    /**
     * Validate a bearer token or an API key.
     */
    Uni<TokenValidationResult> validate(String credential, ValidationContext context);

    /**
     * Revoke a token presented by its holder. Unknown or already revoked tokens are ignored.
     */
    Uni<Void> revoke(String token);
}
