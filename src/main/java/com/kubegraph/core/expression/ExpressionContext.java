package com.kubegraph.core.expression;

/**
 * Where an expression is used, which decides the context-specific validation applied to it.
 */
public enum ExpressionContext {
    /** Readiness conditions and other predicates. */
    BOOLEAN,
    /** Status projections, expected to read observed state. */
    STATUS_FIELD,
    /** Manifest fields and anything else. */
    ANY;

    /** Parses {@code boolean}, {@code status} or {@code any}, case-insensitively. */
    public static ExpressionContext parse(String value) {
        return switch (value.trim().toLowerCase()) {
            case "boolean" -> BOOLEAN;
            case "status", "status-field" -> STATUS_FIELD;
            case "any" -> ANY;
            default -> throw new IllegalArgumentException("Unknown expression context: " + value);
        };
    }
}
