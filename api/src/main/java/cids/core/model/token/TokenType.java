package cids.core.model.token;

import java.util.Optional;

/**
 * Kinds of tokens the broker issues, as carried in the {@code token_type} claim.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh"),
    SERVICE("service");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenType> fromClaim(String value) {
        for (var type : values()) {
            if (type.claimValue.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
