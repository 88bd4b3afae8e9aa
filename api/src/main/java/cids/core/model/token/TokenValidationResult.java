package cids.core.model.token;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of validating a token or API key.
 */
public sealed interface TokenValidationResult {

    boolean isValid();

    /**
     * Credential accepted.
     *
     * @param subject   token subject or API key owner
     * @param claims    full claim set
     * @param tokenType kind of token, null for API keys
     * @param expiresAt expiry, null when the credential does not expire
     */
    record Valid(String subject, Map<String, Object> claims, TokenType tokenType, Instant expiresAt)
            implements TokenValidationResult {

        public Valid {
            claims = claims != null ? Map.copyOf(claims) : Map.of();
        }

        @Override
        public boolean isValid() {
            return true;
        }
    }

    /**
     * Credential rejected.
     */
    record Invalid(ValidationFailure failure, String detail) implements TokenValidationResult {

        @Override
        public boolean isValid() {
            return false;
        }

        public int httpStatus() {
            return failure.httpStatus();
        }
    }

    static Invalid invalid(ValidationFailure failure, String detail) {
        return new Invalid(failure, detail);
    }
}
