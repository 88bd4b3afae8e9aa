package cids.adapter.in.dto;

/**
 * A credential to check.
 *
 * <p>A resource server checking a token on behalf of its own caller passes that
 * caller's {@code ip} and {@code device}. Otherwise the context of the validation
 * request itself is used.
 *
 * @param token    JWT or API key, the Authorization header is used when absent
 * @param audience audience the caller expects, the internal audience when absent
 * @param ip       IP address of the end user presenting the token
 * @param device   device fingerprint of the end user presenting the token
 */
public record ValidateRequest(String token, String audience, String ip, String device) {}
