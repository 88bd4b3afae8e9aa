package cids.spi;

import java.net.URI;

import io.smallrye.mutiny.Uni;

import cids.core.model.token.VerifiedPrincipal;

/**
 * The upstream identity provider that authenticates users.
 *
 * @see cids.adapter.out.idp.OidcIdentityProviderClient
 */
public interface IdentityProviderClient {

    /**
     * URL the browser is redirected to in order to log in.
     *
     * @param redirectUri where the provider sends the user back to
     * @param state       opaque value returned unchanged with the code
     */
    URI authorizationUrl(String redirectUri, String state);

    /**
     * Exchange an authorization code for the authenticated user.
     *
     * @return the user with their group memberships, or a failure with
     *         {@link IdentityProviderException} if the provider rejects the code
     */
    Uni<VerifiedPrincipal> exchangeCode(String code, String redirectUri);

    /**
     * The provider rejected a request or returned something unusable.
     */
    class IdentityProviderException extends RuntimeException {
        public IdentityProviderException(String message) {
            super(message);
        }

        public IdentityProviderException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
