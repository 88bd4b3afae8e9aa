package cids.core.model.role;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Row-level security filter attached to a role.
 *
 * <p>Expressions are passed through to resource servers verbatim. They may only
 * reference whitelisted context variables, and statement separators or comment
 * markers are rejected outright.
 *
 * @param id         stable identifier within the role
 * @param resource   resource the filter applies to
 * @param action     action the filter applies to, {@code read} by default
 * @param field      field the filter targets, or {@code all}
 * @param expression WHERE-clause-like expression
 * @param operator   combination operator
 * @param priority   ordering among filters on the same key, higher first
 */
public record RlsFilter(
        String id,
        String resource,
        String action,
        String field,
        String expression,
        FilterOperator operator,
        int priority) {

    public static final String ALL_FIELDS = "all";
    public static final String DEFAULT_ACTION = "read";

    public static final Set<String> ALLOWED_VARIABLES = Set.of(
            "@current_user_id",
            "@current_user_email",
            "@current_user_name",
            "@current_user_groups",
            "@current_user_department");

    private static final Pattern VARIABLE = Pattern.compile("@[A-Za-z_][A-Za-z0-9_]*");
    private static final Set<String> FORBIDDEN_TOKENS = Set.of(";", "--", "/*", "*/");

    public RlsFilter {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Filter ID cannot be null or blank");
        }
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("Filter resource cannot be null or blank");
        }
        if (action == null || action.isBlank()) {
            action = DEFAULT_ACTION;
        }
        if (field == null || field.isBlank()) {
            field = ALL_FIELDS;
        }
        if (operator == null) {
            operator = FilterOperator.AND;
        }
        validateExpression(expression);
    }

    /**
     * The {@code resource.action} key under which the filter is emitted.
     */
    public String key() {
        return resource + "." + action;
    }

    /**
     * Check that an expression only uses whitelisted variables and contains no
     * statement separators or comments.
     *
     * @throws IllegalArgumentException if the expression is not acceptable
     */
    public static void validateExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Filter expression cannot be null or blank");
        }
        for (var token : FORBIDDEN_TOKENS) {
            if (expression.contains(token)) {
                throw new IllegalArgumentException("Filter expression contains forbidden token '" + token + "'");
            }
        }
        final var matcher = VARIABLE.matcher(expression);
        while (matcher.find()) {
            final var variable = matcher.group();
            if (!ALLOWED_VARIABLES.contains(variable)) {
                throw new IllegalArgumentException("Filter expression uses unknown variable " + variable);
            }
        }
    }
}
