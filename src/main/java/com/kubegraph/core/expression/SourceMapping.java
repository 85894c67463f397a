package com.kubegraph.core.expression;

/**
 * Links one source sub-expression to the fragment emitted for it.
 *
 * @param sourceSpan   range in the author's text ({@link Span#NONE} for built nodes)
 * @param sourceText   the author's text for that range, empty when unknown
 * @param emittedStart start offset in the emitted expression
 * @param emittedEnd   end offset (exclusive) in the emitted expression
 * @param emittedText  the emitted fragment
 */
public record SourceMapping(Span sourceSpan, String sourceText, int emittedStart, int emittedEnd,
                            String emittedText) {

    SourceMapping shift(int offset) {
        return new SourceMapping(sourceSpan, sourceText, emittedStart + offset, emittedEnd + offset, emittedText);
    }
}
