package com.kubegraph.core.expression;

import com.kubegraph.core.reference.Reference;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of scanning a value for references.
 *
 * @param hasReferences true when at least one reference was reachable
 * @param references    distinct references in first-seen order
 * @param truncated     true when the depth bound cut the walk short somewhere
 */
public record DetectionResult(boolean hasReferences, List<Reference> references, boolean truncated) {

    public static final DetectionResult NONE = new DetectionResult(false, List.of(), false);

    public DetectionResult {
        references = List.copyOf(references);
    }

    /** Distinct concrete resource ids, excluding the input-spec sentinel. */
    public Set<String> resourceIds() {
        var ids = new LinkedHashSet<String>();
        for (Reference ref : references) {
            if (!ref.isSchema()) {
                ids.add(ref.resourceId());
            }
        }
        return ids;
    }
}
