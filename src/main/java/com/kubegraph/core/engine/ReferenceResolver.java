package com.kubegraph.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kubegraph.core.KubegraphException;
import com.kubegraph.core.cluster.ClusterApi;
import com.kubegraph.core.cluster.ClusterApiException;
import com.kubegraph.core.cluster.KubernetesPaths;
import com.kubegraph.core.cluster.ResourceKey;
import com.kubegraph.core.events.DeploymentEventType;
import com.kubegraph.core.expression.ExpressionEvaluator;
import com.kubegraph.core.model.GraphResource;
import com.kubegraph.core.reference.FieldPaths;
import com.kubegraph.core.reference.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Replaces references embedded in a manifest with values read from live objects, right before
 * the manifest is applied.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final ExpressionEvaluator evaluator;
    private final ClusterApi clusterApi;
    private final ObjectMapper mapper;

    public ReferenceResolver(ExpressionEvaluator evaluator, ClusterApi clusterApi, ObjectMapper mapper) {
        this.evaluator = evaluator;
        this.clusterApi = clusterApi;
        this.mapper = mapper;
    }

    /**
     * Produces the manifest to apply: every reference substituted, the default namespace filled in.
     *
     * @throws ReferenceResolutionError when a referenced field is absent
     */
    public ObjectNode resolve(DeploymentContext ctx, GraphResource resource) {
        Function<Reference, Object> lookup = ref -> lookup(ctx, resource.id(), ref);
        Object substituted;
        try {
            substituted = evaluator.substitute(resource.manifest(), lookup);
        } catch (ReferenceResolutionError e) {
            throw e;
        } catch (KubegraphException e) {
            throw new ReferenceResolutionError(resource.id(), null,
                    "Failed to evaluate expressions in '" + resource.id() + "': " + e.getMessage(), e);
        }
        return withNamespace(mapper.valueToTree(substituted), ctx.options().namespace());
    }

    /**
     * Manifest for a dry run: schema values substituted, resource references left in their
     * {@code ${...}} form.
     */
    public ObjectNode preview(DeploymentContext ctx, GraphResource resource) {
        JsonNode schema = ctx.schemaRoot();
        Object substituted = evaluator.substitute(resource.manifest(), ref -> ref.isSchema()
                ? FieldPaths.read(schema, ref.fieldPath()).map(this::toValue).orElse(null)
                : "${" + ref.toCelPath() + "}");
        return withNamespace(mapper.valueToTree(substituted), ctx.options().namespace());
    }

    /**
     * Evaluates the status projection against live objects. Absent fields read as null here, so
     * {@code ??} fallbacks apply; a field that fails to evaluate is reported and left null.
     */
    public Map<String, Object> evaluateStatus(DeploymentContext ctx) {
        var values = new LinkedHashMap<String, Object>();
        JsonNode schema = ctx.schemaRoot();
        Function<Reference, Object> lenient = ref -> {
            JsonNode root = ref.isSchema() ? schema : ctx.liveObject(ref.resourceId());
            return root == null ? null : FieldPaths.read(root, ref.fieldPath()).map(this::toValue).orElse(null);
        };
        ctx.graph().statusProjection().forEach((field, expression) -> {
            try {
                values.put(field, evaluator.substitute(expression, lenient));
            } catch (KubegraphException e) {
                log.warn("Status field '{}' could not be evaluated: {}", field, e.getMessage());
                ctx.emitter().emit(DeploymentEventType.RESOURCE_WARNING, null,
                        "Status field '" + field + "' could not be evaluated: " + e.getMessage());
                values.put(field, null);
            }
        });
        return values;
    }

    private Object lookup(DeploymentContext ctx, String resourceId, Reference ref) {
        JsonNode root;
        if (ref.isSchema()) {
            root = ctx.schemaRoot();
        } else if (ctx.graph().resource(ref.resourceId()) != null) {
            root = ctx.liveObject(ref.resourceId());
            if (root == null) {
                throw new ReferenceResolutionError(resourceId, ref.toCelPath(),
                        "Resource '" + ref.resourceId() + "' has not been applied");
            }
        } else {
            root = external(ctx, resourceId, ref);
        }
        Optional<JsonNode> value = FieldPaths.read(root, ref.fieldPath());
        if (value.isEmpty()) {
            throw new ReferenceResolutionError(resourceId, ref.toCelPath(),
                    "Cannot resolve " + ref.toCelPath() + " for '" + resourceId + "': field is absent");
        }
        return toValue(value.get());
    }

    private JsonNode external(DeploymentContext ctx, String resourceId, Reference ref) {
        ObjectNode cached = ctx.liveObject(ref.resourceId());
        if (cached != null) {
            return cached;
        }
        ResourceKey key = ctx.graph().externals().get(ref.resourceId());
        if (key == null) {
            throw new ReferenceResolutionError(resourceId, ref.toCelPath(),
                    "Reference to unknown resource '" + ref.resourceId() + "'");
        }
        try {
            ObjectNode live = clusterApi.get(key);
            ctx.putLiveObject(ref.resourceId(), live);
            log.debug("Resolved external reference '{}' as {}", ref.resourceId(), key);
            return live;
        } catch (ClusterApiException e) {
            throw new ReferenceResolutionError(resourceId, ref.toCelPath(),
                    "External resource " + key + " could not be read: " + e.getMessage(), e);
        }
    }

    private Object toValue(JsonNode node) {
        return mapper.convertValue(node, Object.class);
    }

    static ObjectNode withNamespace(ObjectNode manifest, String namespace) {
        if (namespace == null || KubernetesPaths.isClusterScoped(manifest.path("kind").asText(""))) {
            return manifest;
        }
        ObjectNode metadata = manifest.withObject("/metadata");
        if (metadata.path("namespace").asText("").isEmpty()) {
            metadata.put("namespace", namespace);
        }
        return manifest;
    }
}
