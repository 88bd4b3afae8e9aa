package cids.core.port.out;

import org.jose4j.jwt.JwtClaims;

/**
 * Signs claim sets with the current signing key.
 */
public interface TokenSigner {

    /**
     * @return the compact JWS
     * @throws cids.core.model.token.TokenIssuanceException if no key can sign
     */
    String sign(JwtClaims claims);

    /**
     * Whether an active signing key is available.
     */
    boolean isAvailable();
}
