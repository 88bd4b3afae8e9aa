package cids.adapter.in.dto;

import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonProperty;

import cids.core.model.a2a.ServiceTokenGrant;

public record ServiceTokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("a2a_id") String a2aId,
        String scope) {

    public static ServiceTokenResponse from(ServiceTokenGrant grant) {
        return new ServiceTokenResponse(
                grant.token().token(),
                "Bearer",
                grant.token().expiresInSeconds(),
                grant.a2aId(),
                String.join(" ", new TreeSet<>(grant.scopes())));
    }
}
