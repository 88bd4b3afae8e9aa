package cids.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;

public record BatchDiscoveryRequest(@NotEmpty List<String> clientIds, boolean force) {}
