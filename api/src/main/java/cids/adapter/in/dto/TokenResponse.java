package cids.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import cids.core.model.token.TokenPair;

/**
 * OAuth 2.0 style token response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("refresh_expires_in") Long refreshExpiresIn) {

    public static TokenResponse from(TokenPair pair) {
        return new TokenResponse(
                pair.accessToken().token(),
                "Bearer",
                pair.accessToken().expiresInSeconds(),
                pair.refreshToken(),
                pair.refreshExpiresInSeconds());
    }
}
