package com.kubegraph.core.expression;

import java.util.List;
import java.util.Set;

/**
 * Output of {@link ExpressionCompiler#compile}.
 *
 * @param resultValue            the compiled value: a {@link CompiledExpression}, a manifest tree
 *                               with interpolation strings, or the untouched input
 * @param requiresConversion     false when the input held no references and was returned unchanged
 * @param referencedResourceIds  concrete resource ids the value depends on
 * @param diagnostics            advisory and blocking findings
 * @param sourceMap              source-to-emitted mappings, empty unless CEL text was produced
 */
public record CompileResult(Object resultValue,
                            boolean requiresConversion,
                            Set<String> referencedResourceIds,
                            List<Diagnostic> diagnostics,
                            List<SourceMapping> sourceMap) {

    public CompileResult {
        referencedResourceIds = Set.copyOf(referencedResourceIds);
        diagnostics = List.copyOf(diagnostics);
        sourceMap = List.copyOf(sourceMap);
    }

    static CompileResult unchanged(Object value) {
        return new CompileResult(value, false, Set.of(), List.of(), List.of());
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /** The compiled expression, when the input was a single expression compiled for CEL. */
    public CompiledExpression compiledExpression() {
        return resultValue instanceof CompiledExpression compiled ? compiled : null;
    }
}
