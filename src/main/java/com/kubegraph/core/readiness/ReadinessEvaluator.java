package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Pure function from an observed live object to a verdict. Must be deterministic: the same
 * object always yields the same verdict.
 */
@FunctionalInterface
public interface ReadinessEvaluator {

    ReadinessVerdict evaluate(JsonNode liveObject);
}
