package com.kubegraph.core.expression;

import com.kubegraph.core.ConstructionError;
import com.kubegraph.core.reference.Reference;
import com.kubegraph.core.reference.ResourceRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceDetectorTest {

    private final ReferenceDetector detector = new ReferenceDetector();

    @Test
    @DisplayName("finds references in nested maps, lists and interpolation strings, in first-seen order")
    void findsNestedReferences() {
        Reference host = ResourceRef.of("db").status().field("host");
        Map<String, Object> manifest = Map.of(
                "spec", Map.of(
                        "env", List.of(
                                Map.of("name", "DB_HOST", "value", host),
                                Map.of("name", "DB_URL", "value", "postgres://${resources.db.status.host}:5432"),
                                Map.of("name", "APP", "value", "${schema.spec.name}"))));

        DetectionResult result = detector.detect(manifest);

        assertTrue(result.hasReferences());
        assertFalse(result.truncated());
        assertEquals(Set.of("db"), result.resourceIds());
        assertTrue(result.references().stream().anyMatch(Reference::isSchema));
    }

    @Test
    @DisplayName("a value without references reports none")
    void noReferences() {
        DetectionResult result = detector.detect(Map.of("data", Map.of("greeting", "hello", "count", 3)));

        assertFalse(result.hasReferences());
        assertTrue(result.references().isEmpty());
    }

    @Test
    @DisplayName("detection is idempotent")
    void idempotent() {
        Map<String, Object> manifest = Map.of("a", ResourceRef.of("web").status().field("ready"),
                "b", "${resources.svc.spec.clusterIP}");

        assertEquals(detector.detect(manifest), detector.detect(manifest));
    }

    @Test
    @DisplayName("shell-style placeholders and reference-free holes are plain text")
    void shellPlaceholders() {
        assertFalse(detector.hasReferences("${HOME:-/root}"));
        assertFalse(detector.hasReferences("${FOO}"));
    }

    @Test
    @DisplayName("self-referencing structures terminate")
    void cycleSafe() {
        Map<String, Object> node = new HashMap<>();
        node.put("self", node);
        node.put("ref", ResourceRef.of("web").status().field("ready"));

        DetectionResult result = detector.detect(node);

        assertEquals(Set.of("web"), result.resourceIds());
    }

    @Test
    @DisplayName("the walk is depth bounded and reports truncation")
    void depthBounded() {
        Object value = ResourceRef.of("deep").status().field("x");
        for (int i = 0; i < 100; i++) {
            value = Map.of("next", value);
        }

        DetectionResult bounded = detector.detect(value);
        DetectionResult generous = new ReferenceDetector(200).detect(value);

        assertFalse(bounded.hasReferences());
        assertTrue(bounded.truncated());
        assertTrue(generous.hasReferences());
    }

    @Test
    @DisplayName("serialized marker maps count as references")
    void markerMaps() {
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("__ref__", true);
        marker.put("__resourceId__", "db");
        marker.put("__fieldPath__", "status.host");

        DetectionResult result = detector.detect(Map.of("value", marker));

        assertEquals(List.of(new Reference("db", "status.host")), result.references());
    }

    @Test
    @DisplayName("reserved marker keys inside a field path are rejected")
    void reservedSegment() {
        Reference bad = ResourceRef.of("web").status().field("__ref__");

        ConstructionError error = assertThrows(ConstructionError.class, () -> detector.detect(bad));
        assertEquals(List.of("web"), error.resourceIds());
    }
}
