package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

import static com.kubegraph.core.readiness.LiveObjects.arraySize;
import static com.kubegraph.core.readiness.LiveObjects.boolAt;
import static com.kubegraph.core.readiness.LiveObjects.conditionStatus;
import static com.kubegraph.core.readiness.LiveObjects.has;
import static com.kubegraph.core.readiness.LiveObjects.intAt;
import static com.kubegraph.core.readiness.LiveObjects.statusMissing;

/**
 * Readiness for run-to-completion and scheduled kinds.
 */
final class BatchReadiness {

    private BatchReadiness() {}

    static ReadinessVerdict job(JsonNode live) {
        if (statusMissing(live)) {
            return ReadinessVerdict.notReady("StatusMissing", "Job status not available yet");
        }
        int completions = intAt(live, "spec.completions", 1);
        int backoffLimit = intAt(live, "spec.backoffLimit", 6);
        int succeeded = intAt(live, "status.succeeded", 0);
        int failed = intAt(live, "status.failed", 0);
        Map<String, Object> details = Map.of("completions", completions, "succeeded", succeeded,
                "failed", failed, "backoffLimit", backoffLimit);

        if (failed > backoffLimit || "True".equals(conditionStatus(live, "Failed"))) {
            return ReadinessVerdict.notReady("JobFailed",
                    "Job failed: " + failed + " failed pods exceed backoff limit " + backoffLimit, details);
        }
        if (succeeded >= completions) {
            return ReadinessVerdict.ready("Job completed with " + succeeded + "/" + completions
                    + " successful completions", details);
        }
        return ReadinessVerdict.notReady("JobRunning",
                "Waiting for completions: " + succeeded + "/" + completions, details);
    }

    /**
     * Ready when suspended, or once scheduled at least once, whatever the number of active runs.
     */
    static ReadinessVerdict cronJob(JsonNode live) {
        boolean suspended = boolAt(live, "spec.suspend");
        int active = arraySize(live, "status.active");
        Map<String, Object> details = Map.of("suspended", suspended, "active", active);
        if (suspended) {
            return ReadinessVerdict.ready("CronJob is suspended and ready", details);
        }
        if (statusMissing(live)) {
            return ReadinessVerdict.notReady("StatusMissing", "CronJob status not available yet");
        }
        if (has(live, "status.lastScheduleTime")) {
            return ReadinessVerdict.ready("CronJob is ready with " + active + " active jobs", details);
        }
        return ReadinessVerdict.notReady("NotScheduled", "CronJob has not been scheduled yet", details);
    }
}
