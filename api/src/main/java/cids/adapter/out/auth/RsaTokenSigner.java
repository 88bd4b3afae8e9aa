package cids.adapter.out.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.lang.JoseException;

import cids.core.model.token.TokenIssuanceException;
import cids.core.port.out.TokenSigner;
import cids.core.service.key.SigningKeyRegistry;

/**
 * RS256 signer backed by the active key of the {@link SigningKeyRegistry}.
 *
 * <p>The {@code kid} header names the signing key so verifiers can pick it from the JWKS.
 */
@ApplicationScoped
public class RsaTokenSigner implements TokenSigner {

    private static final Logger LOG = Logger.getLogger(RsaTokenSigner.class);

    private final SigningKeyRegistry keyRegistry;

    @Inject
    public RsaTokenSigner(SigningKeyRegistry keyRegistry) {
        this.keyRegistry = keyRegistry;
    }

    @Override
    public boolean isAvailable() {
        return keyRegistry.isReady();
    }

    @Override
    public String sign(JwtClaims claims) {
        final var key = keyRegistry.getCurrentSigningKey();
        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key.privateKey());
        jws.setKeyIdHeaderValue(key.keyId());
        jws.setHeader("typ", "JWT");
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            LOG.errorv(e, "Failed to sign token with key {0}", key.keyId());
            throw new TokenIssuanceException("Failed to sign token: " + e.getMessage(), e);
        }
    }
}
