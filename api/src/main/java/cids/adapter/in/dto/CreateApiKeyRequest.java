package cids.adapter.in.dto;

/**
 * DTO for API key creation requests.
 *
 * @param name    display name for the key
 * @param ttlDays time-to-live in days (null = never expires, unless a maximum is configured)
 */
public record CreateApiKeyRequest(String name, Integer ttlDays) {}
