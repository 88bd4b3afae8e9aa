package cids.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param token access token or refresh token to revoke
 */
public record RevokeRequest(@NotBlank String token) {}
