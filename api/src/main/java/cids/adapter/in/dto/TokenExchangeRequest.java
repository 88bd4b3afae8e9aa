package cids.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Authorization code exchange.
 *
 * @param clientId     application the tokens are for
 * @param code         authorization code from the identity provider
 * @param redirectUri  redirect URI used for the login, must be registered
 * @param clientSecret the application's secret, required once one was issued
 */
public record TokenExchangeRequest(
        @NotBlank @JsonProperty("client_id") String clientId,
        @NotBlank String code,
        @NotBlank @JsonProperty("redirect_uri") String redirectUri,
        @JsonProperty("client_secret") String clientSecret) {}
