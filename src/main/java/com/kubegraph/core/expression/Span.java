package com.kubegraph.core.expression;

/**
 * Half-open character range {@code [start, end)} into the source text of an expression.
 * Programmatically built nodes carry {@link #NONE}.
 */
public record Span(int start, int end) {

    public static final Span NONE = new Span(-1, -1);

    public boolean isKnown() {
        return start >= 0;
    }

    public Span to(Span other) {
        if (!isKnown()) return other;
        if (!other.isKnown()) return this;
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    public String slice(String source) {
        if (!isKnown() || source == null || end > source.length()) {
            return "";
        }
        return source.substring(start, end);
    }
}
