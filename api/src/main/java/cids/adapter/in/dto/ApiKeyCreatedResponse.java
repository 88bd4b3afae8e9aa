package cids.adapter.in.dto;

import cids.core.model.app.ApiKey;
import cids.core.model.app.ApiKeyCreateResult;

/**
 * A new API key. The plaintext key is only ever returned here.
 */
public record ApiKeyCreatedResponse(String keyId, String key, ApiKey metadata) {

    public static ApiKeyCreatedResponse from(ApiKeyCreateResult result) {
        return new ApiKeyCreatedResponse(result.keyId(), result.plaintextKey(), result.metadata().redacted());
    }
}
