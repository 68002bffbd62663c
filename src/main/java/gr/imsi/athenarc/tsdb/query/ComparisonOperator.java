package gr.imsi.athenarc.tsdb.query;

import gr.imsi.athenarc.tsdb.exception.QueryException;

import java.util.Locale;

/**
 * Operators a {@link Condition} can carry. Each operator has a textual token
 * which callers may pass instead of the enum constant.
 */
public enum ComparisonOperator {
    EQUALS("="),
    SAME("=="),
    NOT_EQUALS("!="),
    NOT_EQUALS_ALT("<>"),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    LIKE("LIKE"),
    REGEX("REGEX"),
    NOT_REGEX("NOT REGEX"),
    IN("IN"),
    NOT_IN("NOT IN"),
    BETWEEN("BETWEEN");

    private final String token;

    ComparisonOperator(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * @return true when the operator works on a list of values rather than a scalar
     */
    public boolean requiresArrayValue() {
        return this == IN || this == NOT_IN || this == BETWEEN;
    }

    public boolean isEquality() {
        return this == EQUALS || this == SAME;
    }

    public boolean isInequality() {
        return this == NOT_EQUALS || this == NOT_EQUALS_ALT;
    }

    /**
     * Operator as written inside a Flux predicate.
     */
    public String toFluxOperator() {
        switch (this) {
            case EQUALS:
            case SAME:
                return "==";
            case NOT_EQUALS:
            case NOT_EQUALS_ALT:
                return "!=";
            case LIKE:
            case REGEX:
                return "=~";
            case NOT_REGEX:
                return "!~";
            default:
                return token;
        }
    }

    /**
     * Resolves a textual token ("=", "!=", "regex", "not in", ...) to its operator.
     * Matching ignores case and surrounding whitespace.
     *
     * @throws QueryException if the token names no operator
     */
    public static ComparisonOperator fromToken(String token) {
        if (token == null) {
            throw new QueryException("Operator must not be null");
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        for (ComparisonOperator operator : values()) {
            if (operator.token.equals(normalized)) {
                return operator;
            }
        }
        throw new QueryException("Unknown comparison operator: " + token);
    }

    @Override
    public String toString() {
        return token;
    }
}
