package cids.core.model.token;

/**
 * What the validating party expects of a presented token.
 *
 * @param expectedAudience audience the token must carry, the internal audience when null
 * @param ipAddress        IP the token is presented from
 * @param deviceFingerprint device the token is presented from
 */
public record ValidationContext(String expectedAudience, String ipAddress, String deviceFingerprint) {

    public static ValidationContext forAudience(String audience) {
        return new ValidationContext(audience, null, null);
    }
}
