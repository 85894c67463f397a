package com.kubegraph.core.expression;

/**
 * Advisory or blocking finding about an expression, separate from parse errors.
 */
public record Diagnostic(Severity severity, String code, String message, Span span) {

    public enum Severity { WARNING, ERROR }

    public static Diagnostic warning(String code, String message, Span span) {
        return new Diagnostic(Severity.WARNING, code, message, span);
    }

    public Diagnostic escalate() {
        return severity == Severity.ERROR ? this : new Diagnostic(Severity.ERROR, code, message, span);
    }
}
