package cids.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param permission permission string, a leading {@code !} makes it a deny
 */
public record GrantRequest(@NotBlank String permission) {}
