package cids.adapter.in.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import cids.core.model.token.TokenValidationResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResponse(boolean valid, Map<String, Object> claims, String error, String detail) {

    public static ValidationResponse from(TokenValidationResult result) {
        if (result instanceof TokenValidationResult.Valid valid) {
            return new ValidationResponse(true, valid.claims(), null, null);
        }
        final var invalid = (TokenValidationResult.Invalid) result;
        return new ValidationResponse(false, null, invalid.failure().name().toLowerCase(), invalid.detail());
    }
}
