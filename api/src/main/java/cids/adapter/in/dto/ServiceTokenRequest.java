package cids.adapter.in.dto;

import java.util.Set;

import jakarta.validation.constraints.NotBlank;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Service token request from one application to call another.
 *
 * @param targetClientId  application to be called
 * @param scopes          scopes wanted, every allowed scope when empty
 * @param durationSeconds requested lifetime, capped by the permission
 */
public record ServiceTokenRequest(
        @NotBlank @JsonProperty("target_client_id") String targetClientId,
        Set<String> scopes,
        @JsonProperty("duration") Long durationSeconds) {}
