package cids.core.model.token;

/**
 * Properties of the request a token is issued to or presented with.
 *
 * @param ipAddress         caller IP, may be null
 * @param deviceFingerprint caller device fingerprint, may be null
 */
public record ClientContext(String ipAddress, String deviceFingerprint) {

    public static ClientContext none() {
        return new ClientContext(null, null);
    }
}
