package com.kubegraph.core.expression;

/**
 * @param context validation context
 * @param strict  when true, advisory diagnostics become blocking
 */
public record CompileOptions(ExpressionContext context, boolean strict) {

    public static final CompileOptions DEFAULT = new CompileOptions(ExpressionContext.ANY, false);

    public CompileOptions {
        context = context == null ? ExpressionContext.ANY : context;
    }

    public static CompileOptions of(ExpressionContext context) {
        return new CompileOptions(context, false);
    }
}
