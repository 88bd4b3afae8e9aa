package cids.adapter.in.dto;

public record RotateKeyRequest(String reason) {}
