package com.kubegraph.core.readiness;

import java.util.Map;
import java.util.Set;

/**
 * Structured result of a readiness check, distinct from mere existence.
 *
 * @param ready   whether dependents may proceed
 * @param reason  short machine-readable reason when not ready (e.g. {@code ReplicasNotReady})
 * @param message human-readable explanation
 * @param details observed values the verdict was based on
 */
public record ReadinessVerdict(boolean ready, String reason, String message, Map<String, Object> details) {

    /** Reasons after which the object will not become ready without outside intervention. */
    public static final Set<String> TERMINAL_REASONS = Set.of("JobFailed", "InstanceFailed");

    public ReadinessVerdict {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ReadinessVerdict ready(String message) {
        return new ReadinessVerdict(true, null, message, Map.of());
    }

    public static ReadinessVerdict ready(String message, Map<String, Object> details) {
        return new ReadinessVerdict(true, null, message, details);
    }

    public static ReadinessVerdict notReady(String reason, String message) {
        return new ReadinessVerdict(false, reason, message, Map.of());
    }

    public static ReadinessVerdict notReady(String reason, String message, Map<String, Object> details) {
        return new ReadinessVerdict(false, reason, message, details);
    }

    public boolean isTerminal() {
        return !ready && reason != null && TERMINAL_REASONS.contains(reason);
    }
}
