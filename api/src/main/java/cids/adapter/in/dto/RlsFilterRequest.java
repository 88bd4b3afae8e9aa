package cids.adapter.in.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;

import cids.core.model.role.FilterOperator;
import cids.core.model.role.RlsFilter;

/**
 * Row-level filter for a role, e.g. {@code department = @current_user_department}.
 */
public record RlsFilterRequest(
        @NotBlank String resource,
        String action,
        String field,
        @NotBlank String expression,
        FilterOperator operator,
        int priority) {

    public RlsFilter toFilter() {
        return new RlsFilter(UUID.randomUUID().toString(), resource, action, field, expression, operator, priority);
    }
}
