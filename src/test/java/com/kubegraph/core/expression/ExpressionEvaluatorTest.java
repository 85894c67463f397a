package com.kubegraph.core.expression;

import com.kubegraph.core.reference.Reference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private final Map<String, Object> values = new HashMap<>();
    private final Function<Reference, Object> resolver = ref -> values.get(ref.toCelPath());

    private Object eval(String text) {
        return evaluator.evaluate(Expressions.parse(text), resolver);
    }

    @Test
    @DisplayName("readiness comparison reads the live value")
    void readinessComparison() {
        values.put("resources.web.status.readyReplicas", 2);
        assertEquals(true, eval("resources.web.status.readyReplicas > 0"));

        values.put("resources.web.status.readyReplicas", 0);
        assertEquals(false, eval("resources.web.status.readyReplicas > 0"));
    }

    @Test
    @DisplayName("integral arithmetic yields Long")
    void arithmetic() {
        values.put("resources.a.spec.x", 3);
        assertEquals(6L, eval("resources.a.spec.x * 2"));
        assertEquals(1.5, eval("resources.a.spec.x / 2"));
    }

    @Test
    @DisplayName("?? falls back only on null")
    void nullishFallback() {
        assertEquals("none", eval("resources.a.status.host ?? \"none\""));

        values.put("resources.a.status.host", "");
        assertEquals("", eval("resources.a.status.host ?? \"none\""));
    }

    @Test
    @DisplayName("string methods and collection callbacks evaluate")
    void methods() {
        values.put("resources.web.metadata.name", "Web-API");
        values.put("resources.a.spec.items", List.of(Map.of("name", "x"), Map.of("name", "y")));

        assertEquals("web-api", eval("resources.web.metadata.name.toLowerCase()"));
        assertEquals(true, eval("resources.web.metadata.name.includes(\"API\")"));
        assertEquals(List.of("x", "y"), eval("resources.a.spec.items.map(i => i.name)"));
        assertEquals(2L, eval("resources.a.spec.items.length"));
    }

    @Test
    @DisplayName("unknown identifiers fail evaluation")
    void unknownIdentifier() {
        assertThrows(EvaluationError.class, () -> eval("foo + 1"));
    }

    @Test
    @DisplayName("substitution keeps the type of a whole-string hole and renders templates as text")
    void substitution() {
        values.put("resources.db.status.port", 5432L);
        values.put("schema.spec.name", "app");
        Map<String, Object> manifest = Map.of(
                "port", "${resources.db.status.port}",
                "name", "${schema.spec.name}-svc",
                "shell", "${HOME:-/root}",
                "list", List.of("${schema.spec.name}"));

        Map<?, ?> result = (Map<?, ?>) evaluator.substitute(manifest, resolver);

        assertEquals(5432L, result.get("port"));
        assertEquals("app-svc", result.get("name"));
        assertEquals("${HOME:-/root}", result.get("shell"));
        assertEquals(List.of("app"), result.get("list"));
    }
}
