package com.kubegraph.core.expression;

import com.kubegraph.core.KubegraphException;

/**
 * An expression cannot be represented in the target syntax, or cannot be parsed at all.
 */
public class CompileError extends KubegraphException {

    private final String code;
    private final String expression;
    private final Span span;

    public CompileError(String code, String message, String expression, Span span) {
        super(message);
        this.code = code;
        this.expression = expression;
        this.span = span == null ? Span.NONE : span;
    }

    public CompileError(String code, String message, Span span) {
        this(code, message, null, span);
    }

    public String code() {
        return code;
    }

    public String expression() {
        return expression;
    }

    public Span span() {
        return span;
    }

    /** Same error, annotated with the full source text it was raised for. */
    CompileError withExpression(String source) {
        if (expression != null || source == null) {
            return this;
        }
        return new CompileError(code, getMessage(), source, span);
    }
}
