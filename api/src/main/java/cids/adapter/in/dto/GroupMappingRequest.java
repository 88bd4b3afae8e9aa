package cids.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

public record GroupMappingRequest(@NotBlank String groupName, @NotBlank String roleName) {}
