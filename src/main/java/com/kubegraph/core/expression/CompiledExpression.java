package com.kubegraph.core.expression;

/**
 * Target-syntax form of an author expression. Opaque once produced.
 *
 * @param expressionText CEL text without the {@code ${ }} delimiters
 * @param resultType     inferred type of the value the expression yields
 */
public record CompiledExpression(String expressionText, Class<?> resultType) {

    /** Delimited form embedded verbatim in control-loop manifests. */
    public String interpolation() {
        return "${" + expressionText + "}";
    }

    @Override
    public String toString() {
        return expressionText;
    }
}
