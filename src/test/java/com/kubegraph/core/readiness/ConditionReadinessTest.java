package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubegraph.core.expression.ExpressionEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionReadinessTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    private static JsonNode status(Map<String, Object> status) {
        return MAPPER.valueToTree(Map.of("status", status));
    }

    @Test
    @DisplayName("ready when every condition holds against the live object")
    void allConditionsHold() {
        var readiness = new ConditionReadiness("db", List.of(
                "${resources.db.status.phase == \"Ready\"}",
                "resources.db.status.replicas >= 2"), evaluator);

        assertTrue(readiness.evaluate(status(Map.of("phase", "Ready", "replicas", 2))).ready());
    }

    @Test
    @DisplayName("the first failing condition is reported")
    void failingCondition() {
        var readiness = new ConditionReadiness("db", List.of(
                "resources.db.status.phase == \"Ready\"",
                "resources.db.status.replicas >= 2"), evaluator);

        ReadinessVerdict verdict = readiness.evaluate(status(Map.of("phase", "Ready", "replicas", 1)));

        assertFalse(verdict.ready());
        assertEquals("ConditionFalse", verdict.reason());
        assertEquals("resources.db.status.replicas >= 2", verdict.details().get("condition"));
    }

    @Test
    @DisplayName("absent fields make a comparison false rather than failing")
    void absentField() {
        var readiness = new ConditionReadiness("db", List.of("resources.db.status.replicas >= 2"), evaluator);

        assertEquals("ConditionFalse", readiness.evaluate(status(Map.of())).reason());
    }

    @Test
    @DisplayName("an evaluation failure is reported as not ready")
    void evaluationFailure() {
        var readiness = new ConditionReadiness("db", List.of("resources.db.status.phase.toLowerCase() == \"ready\""), evaluator);

        assertEquals("ConditionError", readiness.evaluate(status(Map.of())).reason());
    }
}
