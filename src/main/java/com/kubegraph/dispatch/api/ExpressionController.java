package com.kubegraph.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kubegraph.core.expression.CompileError;
import com.kubegraph.core.expression.CompileOptions;
import com.kubegraph.core.expression.CompileResult;
import com.kubegraph.core.expression.CompileTarget;
import com.kubegraph.core.expression.CompiledExpression;
import com.kubegraph.core.expression.Diagnostic;
import com.kubegraph.core.expression.ExpressionCompiler;
import com.kubegraph.core.expression.ExpressionContext;
import com.kubegraph.core.expression.SourceMapping;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * REST controller for compiling expressions to CEL without deploying anything.
 */
@RestController
@RequestMapping("/api/v1/expressions")
public class ExpressionController {

    private final ExpressionCompiler compiler;

    public ExpressionController(ExpressionCompiler compiler) {
        this.compiler = compiler;
    }

    /**
     * POST /api/v1/expressions/compile: Compile one expression.
     */
    @PostMapping("/compile")
    public ResponseEntity<?> compile(@RequestBody CompileRequest request) {
        if (request.expression() == null || request.expression().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Expression is required"));
        }
        ExpressionContext context;
        try {
            context = request.context() != null ? ExpressionContext.parse(request.context()) : ExpressionContext.ANY;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        CompileResult result;
        try {
            result = compiler.compileText(request.expression(), CompileTarget.CEL,
                    new CompileOptions(context, Boolean.TRUE.equals(request.strict())));
        } catch (CompileError e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("code", e.code());
            if (e.span() != null && e.span().isKnown()) {
                body.put("span", Map.of("start", e.span().start(), "end", e.span().end()));
            }
            return ResponseEntity.badRequest().body(body);
        }
        return ResponseEntity.ok(CompileResponse.from(request.expression(), result));
    }

    public record CompileRequest(String expression, String context, Boolean strict) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CompileResponse(
        String expression,
        boolean requiresConversion,
        String cel,
        String resultType,
        List<String> references,
        List<DiagnosticResponse> diagnostics,
        List<MappingResponse> sourceMap
    ) {

        static CompileResponse from(String source, CompileResult result) {
            CompiledExpression compiled = result.compiledExpression();
            return new CompileResponse(
                    source,
                    result.requiresConversion(),
                    compiled != null ? compiled.expressionText() : null,
                    compiled != null ? compiled.resultType().getSimpleName() : null,
                    List.copyOf(new TreeSet<>(result.referencedResourceIds())),
                    result.diagnostics().stream().map(DiagnosticResponse::from).toList(),
                    result.sourceMap().stream().map(MappingResponse::from).toList());
        }
    }

    public record DiagnosticResponse(String severity, String code, String message) {
        static DiagnosticResponse from(Diagnostic d) {
            return new DiagnosticResponse(d.severity().name().toLowerCase(), d.code(), d.message());
        }
    }

    public record MappingResponse(String source, String emitted, int emittedStart, int emittedEnd) {
        static MappingResponse from(SourceMapping m) {
            return new MappingResponse(m.sourceText(), m.emittedText(), m.emittedStart(), m.emittedEnd());
        }
    }
}
