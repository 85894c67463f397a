package com.kubegraph.core.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceTest {

    @Nested
    @DisplayName("ResourceRef accessors")
    class AccessorTests {

        @Test
        @DisplayName("status field read yields a reference tagged with id and path")
        void statusFieldRead() {
            Reference ref = ResourceRef.of("web").status().field("readyReplicas");

            assertEquals("web", ref.resourceId());
            assertEquals("status.readyReplicas", ref.fieldPath());
            assertEquals("resources.web.status.readyReplicas", ref.toCelPath());
            assertTrue(ref.isStatusField());
        }

        @Test
        @DisplayName("reading a field of a field composes the path")
        void nestedFieldComposition() {
            Reference ref = ResourceRef.of("lb").status().field("loadBalancer").field("ingress").index(0).field("ip");

            assertEquals("status.loadBalancer.ingress[0].ip", ref.fieldPath());
        }

        @Test
        @DisplayName("schema accessor produces schema-rooted paths")
        void schemaAccessor() {
            Reference ref = ResourceRef.schema().at("spec.name");

            assertTrue(ref.isSchema());
            assertEquals("schema.spec.name", ref.toCelPath());
            assertFalse(ref.isStatusField());
        }

        @Test
        @DisplayName("empty field name leaves the reference unchanged")
        void emptyFieldName() {
            Reference ref = ResourceRef.of("web").spec();
            assertSame(ref, ref.field(""));
        }

        @Test
        @DisplayName("as() changes only the value type")
        void typedReference() {
            Reference ref = ResourceRef.of("web").at("status.ready").as(Boolean.class);

            assertEquals(Boolean.class, ref.valueType());
            assertEquals("status.ready", ref.fieldPath());
        }

        @Test
        @DisplayName("metadata reads are not status fields")
        void metadataIsNotStatus() {
            assertFalse(ResourceRef.of("web").metadata().field("name").isStatusField());
        }
    }

    @Nested
    @DisplayName("FieldPaths")
    class FieldPathsTests {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        @DisplayName("splits dotted paths with index segments")
        void segments() {
            assertEquals(List.of("spec", "containers", "0", "image"),
                    FieldPaths.segments("spec.containers[0].image"));
            assertEquals(List.of(), FieldPaths.segments(""));
        }

        @Test
        @DisplayName("reads nested values through arrays")
        void readsNestedValues() {
            JsonNode live = mapper.valueToTree(Map.of("status", Map.of(
                    "loadBalancer", Map.of("ingress", List.of(Map.of("ip", "10.0.0.7"))))));

            assertEquals("10.0.0.7",
                    FieldPaths.read(live, "status.loadBalancer.ingress[0].ip").orElseThrow().asText());
        }

        @Test
        @DisplayName("absent, null or out-of-range segments read as empty")
        void absentSegments() {
            JsonNode live = mapper.valueToTree(Map.of("status", Map.of("list", List.of())));

            assertTrue(FieldPaths.read(live, "status.readyReplicas").isEmpty());
            assertTrue(FieldPaths.read(live, "status.list[3]").isEmpty());
            assertTrue(FieldPaths.read(live, "spec.replicas.value").isEmpty());
        }
    }
}
