package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;

import static com.kubegraph.core.readiness.LiveObjects.condition;
import static com.kubegraph.core.readiness.LiveObjects.textAt;

/**
 * Fallback for kinds without a bespoke evaluator: the object exists and reports no fatal
 * condition ({@code Ready=False}, {@code Available=False} or {@code Failed=True}).
 */
final class GenericReadiness {

    private GenericReadiness() {}

    static ReadinessVerdict evaluate(JsonNode live) {
        if (live == null || live.isNull() || live.isMissingNode()) {
            return ReadinessVerdict.notReady("NotFound", "Resource does not exist");
        }
        for (String type : new String[]{"Ready", "Available"}) {
            JsonNode condition = condition(live, type);
            if (condition != null && "False".equals(condition.path("status").asText())) {
                return ReadinessVerdict.notReady("ConditionFalse",
                        type + " condition is False: " + condition.path("message").asText(
                                condition.path("reason").asText("no reason given")));
            }
        }
        JsonNode failed = condition(live, "Failed");
        if (failed != null && "True".equals(failed.path("status").asText())) {
            return ReadinessVerdict.notReady("ConditionFalse",
                    "Failed condition is True: " + failed.path("message").asText(""));
        }
        return ReadinessVerdict.ready(textAt(live, "kind", "Resource") + " exists with no failing conditions");
    }
}
