package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.expression.Expr;
import com.kubegraph.core.expression.ExpressionEvaluator;
import com.kubegraph.core.expression.ExpressionParser;
import com.kubegraph.core.reference.FieldPaths;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Readiness from author-supplied {@code readyWhen} conditions. Each condition reads the resource's
 * own live object through {@code resources.<id>.*}; all must hold.
 */
public final class ConditionReadiness implements ReadinessEvaluator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String resourceId;
    private final List<String> sources;
    private final List<Expr> conditions;
    private final ExpressionEvaluator evaluator;

    /**
     * @param conditions condition texts, with or without the {@code ${...}} wrapper
     */
    public ConditionReadiness(String resourceId, List<String> conditions, ExpressionEvaluator evaluator) {
        this.resourceId = resourceId;
        this.sources = List.copyOf(conditions);
        this.evaluator = evaluator;
        this.conditions = new ArrayList<>();
        for (String condition : conditions) {
            this.conditions.add(ExpressionParser.containsInterpolation(condition)
                    ? ExpressionParser.parseInterpolated(condition)
                    : new ExpressionParser(condition).parse());
        }
    }

    @Override
    public ReadinessVerdict evaluate(JsonNode live) {
        for (int i = 0; i < conditions.size(); i++) {
            Object result;
            try {
                result = evaluator.evaluate(conditions.get(i), ref -> ref.isSchema() || !ref.resourceId().equals(resourceId)
                        ? null
                        : FieldPaths.read(live, ref.fieldPath()).map(n -> MAPPER.convertValue(n, Object.class)).orElse(null));
            } catch (KubegraphException e) {
                return ReadinessVerdict.notReady("ConditionError",
                        "readyWhen condition '" + sources.get(i) + "' failed: " + e.getMessage());
            }
            if (!Boolean.TRUE.equals(result)) {
                return ReadinessVerdict.notReady("ConditionFalse",
                        "readyWhen condition not met: " + sources.get(i), Map.of("condition", sources.get(i)));
            }
        }
        return ReadinessVerdict.ready("All readyWhen conditions met");
    }
}
