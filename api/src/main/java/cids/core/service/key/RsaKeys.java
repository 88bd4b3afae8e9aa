package cids.core.service.key;

import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.UUID;

/**
 * RSA key generation and PEM parsing.
 */
public final class RsaKeys {

    private static final DateTimeFormatter KEY_ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private RsaKeys() {}

    public static KeyPair generate(int keySize) {
        try {
            final var generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(keySize);
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA algorithm not available", e);
        }
    }

    /**
     * Key identifier of the form {@code k-20240115-a1b2c3d4}.
     */
    public static String newKeyId() {
        final var date = LocalDate.now(ZoneOffset.UTC).format(KEY_ID_DATE);
        return "k-" + date + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Parse a PKCS8 private key, PEM armored or bare base64.
     *
     * @throws IllegalArgumentException if the data is not an RSA private key
     */
    public static RSAPrivateKey parsePrivateKey(String keyData) {
        try {
            final var base64 = keyData.replaceAll("-----(BEGIN|END) (RSA )?PRIVATE KEY-----", "")
                    .replaceAll("\\s", "");
            final var spec = new PKCS8EncodedKeySpec(Base64.getDecoder().decode(base64));
            return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(spec);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse RSA private key", e);
        }
    }

    /**
     * Public half of a CRT private key.
     *
     * @throws IllegalArgumentException if the key carries no public exponent
     */
    public static RSAPublicKey derivePublicKey(RSAPrivateKey privateKey) {
        if (!(privateKey instanceof RSAPrivateCrtKey crtKey)) {
            throw new IllegalArgumentException("Cannot derive public key from non-CRT private key");
        }
        try {
            final var spec = new RSAPublicKeySpec(crtKey.getModulus(), crtKey.getPublicExponent());
            return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(spec);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to derive RSA public key", e);
        }
    }
}
