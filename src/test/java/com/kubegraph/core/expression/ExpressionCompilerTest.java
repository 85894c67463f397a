package com.kubegraph.core.expression;

import com.kubegraph.core.reference.ResourceRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionCompilerTest {

    private final ExpressionCompiler compiler = new ExpressionCompiler();

    @Nested
    @DisplayName("CEL target")
    class CelTests {

        @Test
        @DisplayName("a readiness comparison compiles to the same text")
        void readinessComparison() {
            CompileResult result = compiler.compileText("resources.web.status.readyReplicas > 0",
                    CompileTarget.CEL, CompileOptions.DEFAULT);

            assertTrue(result.requiresConversion());
            assertEquals("resources.web.status.readyReplicas > 0", result.compiledExpression().expressionText());
            assertEquals(Boolean.class, result.compiledExpression().resultType());
            assertEquals(Set.of("web"), result.referencedResourceIds());
            assertFalse(result.sourceMap().isEmpty());
        }

        @Test
        @DisplayName("built expression trees compile like parsed text")
        void builtExpression() {
            Expr expr = Expressions.gt(ResourceRef.of("web").status().field("readyReplicas"), 0);

            CompileResult result = compiler.compile(expr, CompileTarget.CEL);

            assertEquals("resources.web.status.readyReplicas > 0", result.compiledExpression().toString());
            assertEquals("${resources.web.status.readyReplicas > 0}", result.compiledExpression().interpolation());
        }

        @Test
        @DisplayName("manifests get interpolation strings in place of references")
        void manifestInterpolation() {
            Map<String, Object> manifest = Map.of("data", Map.of(
                    "host", ResourceRef.of("db").status().field("host"),
                    "url", "postgres://${resources.db.status.host}:5432",
                    "plain", "value"));

            CompileResult result = compiler.compile(manifest, CompileTarget.CEL);

            Map<?, ?> data = (Map<?, ?>) ((Map<?, ?>) result.resultValue()).get("data");
            assertEquals("${resources.db.status.host}", data.get("host"));
            assertEquals("postgres://${resources.db.status.host}:5432", data.get("url"));
            assertEquals("value", data.get("plain"));
            assertNull(result.compiledExpression());
        }

        @Test
        @DisplayName("unsupported constructs fail with the source attached")
        void compileErrorCarriesSource() {
            String source = "resources.web.status.ready == true || \"x\"";

            CompileError error = assertThrows(CompileError.class,
                    () -> compiler.compileText(source, CompileTarget.CEL, CompileOptions.DEFAULT));

            assertEquals("UNSUPPORTED_FALLBACK", error.code());
            assertEquals(source, error.expression());
        }

        @Test
        @DisplayName("a manifest nested past the configured depth is rejected instead of leaking references")
        void depthLimit() {
            var shallow = new ExpressionCompiler(new ReferenceDetector(2), new ContextValidator());
            Map<String, Object> manifest = Map.of("spec", Map.of("template", Map.of(
                    "host", ResourceRef.of("db").status().field("host"))));

            CompileError compileError = assertThrows(CompileError.class,
                    () -> shallow.compile(manifest, CompileTarget.CEL));
            CompileError manifestError = assertThrows(CompileError.class, () -> shallow.toManifest(manifest));

            assertEquals("MAX_DEPTH_EXCEEDED", compileError.code());
            assertEquals("MAX_DEPTH_EXCEEDED", manifestError.code());
            assertInstanceOf(Map.class, shallow.toManifest(Map.of("spec", Map.of("replicas", 2))));
        }

        @Test
        @DisplayName("malformed text is a parse error")
        void parseError() {
            CompileError error = assertThrows(CompileError.class,
                    () -> compiler.compileText("resources.web.status.ready >", CompileTarget.CEL, CompileOptions.DEFAULT));
            assertEquals("PARSE_ERROR", error.code());
        }
    }

    @Nested
    @DisplayName("Reference-free and direct inputs")
    class PassThroughTests {

        @Test
        @DisplayName("values without references come back unchanged")
        void unchanged() {
            Map<String, Object> manifest = Map.of("data", Map.of("k", "v"));

            CompileResult result = compiler.compile(manifest, CompileTarget.CEL);

            assertFalse(result.requiresConversion());
            assertSame(manifest, result.resultValue());
            assertTrue(result.referencedResourceIds().isEmpty());
        }

        @Test
        @DisplayName("reference-free expression text is not converted")
        void unchangedText() {
            CompileResult result = compiler.compileText("1 + 2", CompileTarget.CEL, CompileOptions.DEFAULT);

            assertFalse(result.requiresConversion());
            assertEquals("1 + 2", result.resultValue());
            assertNull(result.compiledExpression());
        }

        @Test
        @DisplayName("the direct target keeps the original value")
        void directTarget() {
            Object ref = ResourceRef.of("db").status().field("host");
            Map<String, Object> manifest = Map.of("host", ref);

            CompileResult result = compiler.compile(manifest, CompileTarget.DIRECT);

            assertTrue(result.requiresConversion());
            assertSame(manifest, result.resultValue());
            assertEquals(Set.of("db"), result.referencedResourceIds());
        }
    }

    @Nested
    @DisplayName("Context validation")
    class ContextTests {

        @Test
        @DisplayName("a non-boolean readiness condition is a warning")
        void expectedBoolean() {
            CompileResult result = compiler.compileText("resources.web.status.replicas + 1",
                    CompileTarget.CEL, CompileOptions.of(ExpressionContext.BOOLEAN));

            assertEquals(1, result.diagnostics().size());
            Diagnostic diagnostic = result.diagnostics().get(0);
            assertEquals("EXPECTED_BOOLEAN", diagnostic.code());
            assertEquals(Diagnostic.Severity.WARNING, diagnostic.severity());
            assertFalse(result.hasErrors());
        }

        @Test
        @DisplayName("strict mode turns warnings into a compile error")
        void strictEscalates() {
            CompileError error = assertThrows(CompileError.class, () -> compiler.compileText(
                    "resources.web.status.replicas + 1", CompileTarget.CEL,
                    new CompileOptions(ExpressionContext.BOOLEAN, true)));

            assertEquals("EXPECTED_BOOLEAN", error.code());
        }

        @Test
        @DisplayName("status projections should read status fields")
        void nonStatusReference() {
            CompileResult result = compiler.compileText("resources.web.spec.replicas",
                    CompileTarget.CEL, CompileOptions.of(ExpressionContext.STATUS_FIELD));

            assertEquals(List.of("NON_STATUS_REFERENCE"),
                    result.diagnostics().stream().map(Diagnostic::code).toList());
        }

        @Test
        @DisplayName("metadata and schema reads are fine in a status projection")
        void metadataAllowed() {
            CompileResult result = compiler.compileText("resources.web.metadata.name + schema.spec.suffix",
                    CompileTarget.CEL, CompileOptions.of(ExpressionContext.STATUS_FIELD));

            assertTrue(result.diagnostics().isEmpty());
        }

        @Test
        @DisplayName("context names parse case-insensitively")
        void parseContext() {
            assertEquals(ExpressionContext.STATUS_FIELD, ExpressionContext.parse(" Status-Field "));
            assertThrows(IllegalArgumentException.class, () -> ExpressionContext.parse("nope"));
        }
    }
}
