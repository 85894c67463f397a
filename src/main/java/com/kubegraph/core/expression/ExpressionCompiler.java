package com.kubegraph.core.expression;

import com.kubegraph.core.reference.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point for turning author values into their target form.
 *
 * <p>A value without references comes back untouched with {@code requiresConversion=false}.
 * For {@link CompileTarget#CEL} a single expression becomes a {@link CompiledExpression} and a
 * structured value (a manifest) becomes a copy whose embedded expressions are replaced by
 * {@code ${...}} interpolation strings. For {@link CompileTarget#DIRECT} the value is returned as
 * is, still holding its references, to be substituted at apply time.
 */
public class ExpressionCompiler {

    private static final Logger log = LoggerFactory.getLogger(ExpressionCompiler.class);

    private final ReferenceDetector detector;
    private final ContextValidator validator;

    public ExpressionCompiler() {
        this(new ReferenceDetector(), new ContextValidator());
    }

    public ExpressionCompiler(ReferenceDetector detector, ContextValidator validator) {
        this.detector = detector;
        this.validator = validator;
    }

    public ReferenceDetector detector() {
        return detector;
    }

    public CompileResult compile(Object value, CompileTarget target) {
        return compile(value, target, CompileOptions.DEFAULT);
    }

    public CompileResult compile(Object value, CompileTarget target, CompileOptions options) {
        DetectionResult detection = detector.detect(value);
        boolean single = value instanceof Expr || value instanceof Reference || value instanceof String;
        if (target == CompileTarget.CEL && !single && detection.truncated()) {
            throw depthExceeded();
        }
        if (!detection.hasReferences()) {
            return CompileResult.unchanged(value);
        }
        String source = value instanceof String text ? text : null;
        Expr expr = single ? toExpr(value) : null;

        List<Diagnostic> diagnostics = expr != null
                ? validator.validate(expr, detection.references(), options.context())
                : List.of();
        diagnostics = applyStrictness(diagnostics, options, source);

        if (target == CompileTarget.DIRECT) {
            return new CompileResult(value, true, detection.resourceIds(), diagnostics, List.of());
        }
        if (expr != null) {
            CelEmitter.Emission emission;
            try {
                emission = new CelEmitter(source).emit(expr);
            } catch (CompileError e) {
                throw e.withExpression(source);
            }
            log.debug("Compiled expression to CEL: {}", emission.text());
            var compiled = new CompiledExpression(emission.text(), ExpressionTypes.resultType(expr));
            return new CompileResult(compiled, true, detection.resourceIds(), diagnostics, emission.mappings());
        }
        return new CompileResult(toManifest(value), true, detection.resourceIds(), diagnostics, List.of());
    }

    /**
     * Parses and compiles expression text such as {@code resources.web.status.readyReplicas > 0}.
     * Text without references is returned unchanged.
     */
    public CompileResult compileText(String expression, CompileTarget target, CompileOptions options) {
        Expr parsed = new ExpressionParser(expression).parse();
        DetectionResult detection = detector.detect(parsed);
        if (!detection.hasReferences()) {
            return CompileResult.unchanged(expression);
        }
        List<Diagnostic> diagnostics = applyStrictness(
                validator.validate(parsed, detection.references(), options.context()), options, expression);
        if (target == CompileTarget.DIRECT) {
            return new CompileResult(parsed, true, detection.resourceIds(), diagnostics, List.of());
        }
        CelEmitter.Emission emission;
        try {
            emission = new CelEmitter(expression).emit(parsed);
        } catch (CompileError e) {
            throw e.withExpression(expression);
        }
        var compiled = new CompiledExpression(emission.text(), ExpressionTypes.resultType(parsed));
        return new CompileResult(compiled, true, detection.resourceIds(), diagnostics, emission.mappings());
    }

    /**
     * Deep copy of a manifest tree in which every reference and expression is replaced by its
     * {@code ${...}} interpolation string.
     *
     * @throws CompileError with code {@code MAX_DEPTH_EXCEEDED} when the tree nests deeper than the
     *                      detector's maximum depth
     */
    public Object toManifest(Object value) {
        return toManifest(value, 0);
    }

    private Object toManifest(Object value, int depth) {
        if (value == null) {
            return null;
        }
        if (depth > detector.maxDepth()) {
            throw depthExceeded();
        }
        if (value instanceof Reference ref) {
            return "${" + ref.toCelPath() + "}";
        }
        if (value instanceof Expr expr) {
            return new CelEmitter().emitInterpolation(expr);
        }
        if (value instanceof String text) {
            return interpolate(text);
        }
        if (value instanceof Map<?, ?> map) {
            Reference marker = ReferenceDetector.markerReference(map);
            if (marker != null) {
                return "${" + marker.toCelPath() + "}";
            }
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), toManifest(v, depth + 1)));
            return copy;
        }
        if (value instanceof Iterable<?> iterable) {
            var copy = new ArrayList<Object>();
            iterable.forEach(item -> copy.add(toManifest(item, depth + 1)));
            return copy;
        }
        return value;
    }

    private String interpolate(String text) {
        if (!ExpressionParser.containsInterpolation(text) || !detector.hasReferences(text)) {
            return text;
        }
        Expr parsed = ExpressionParser.parseInterpolated(text);
        try {
            return new CelEmitter(text).emitInterpolation(parsed);
        } catch (CompileError e) {
            throw e.withExpression(text);
        }
    }

    private CompileError depthExceeded() {
        return new CompileError("MAX_DEPTH_EXCEEDED",
                "Value nests deeper than " + detector.maxDepth() + " levels; references below that depth cannot be compiled",
                Span.NONE);
    }

    static Expr toExpr(Object value) {
        if (value instanceof Expr expr) {
            return expr;
        }
        if (value instanceof Reference ref) {
            return new Expr.FieldRef(ref, Span.NONE);
        }
        return ExpressionParser.parseInterpolated((String) value);
    }

    private static List<Diagnostic> applyStrictness(List<Diagnostic> diagnostics, CompileOptions options,
                                                    String source) {
        if (!options.strict() || diagnostics.isEmpty()) {
            return diagnostics;
        }
        var escalated = diagnostics.stream().map(Diagnostic::escalate).collect(Collectors.toList());
        String messages = escalated.stream().map(Diagnostic::message).collect(Collectors.joining("; "));
        throw new CompileError(escalated.get(0).code(), "Strict validation failed: " + messages,
                source, escalated.get(0).span());
    }
}
