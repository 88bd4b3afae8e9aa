package cids.core.model.app;

/**
 * A newly created API key. The plaintext is only ever available here.
 */
public record ApiKeyCreateResult(String keyId, String plaintextKey, ApiKey metadata) {}
