package com.kubegraph.core.reference;

/**
 * Accessor wrapping a resource under construction. Every read yields a {@link Reference}
 * tagged with the resource id and the path read; nothing here ever touches a live cluster.
 *
 * <pre>{@code
 * ResourceRef web = ResourceRef.of("web");
 * Reference ready = web.status().field("readyReplicas");   // resources.web.status.readyReplicas
 * Reference name  = ResourceRef.schema().at("spec.name");   // schema.spec.name
 * }</pre>
 */
public final class ResourceRef {

    private final String resourceId;

    private ResourceRef(String resourceId) {
        this.resourceId = resourceId;
    }

    public static ResourceRef of(String resourceId) {
        return new ResourceRef(resourceId);
    }

    /** Accessor for the graph's own input spec. */
    public static ResourceRef schema() {
        return new ResourceRef(Reference.SCHEMA_ID);
    }

    public String resourceId() {
        return resourceId;
    }

    public Reference spec() {
        return root().field("spec");
    }

    public Reference status() {
        return root().field("status");
    }

    public Reference metadata() {
        return root().field("metadata");
    }

    public Reference field(String name) {
        return root().field(name);
    }

    /** Reference for a full dotted path, e.g. {@code status.loadBalancer.ingress[0].ip}. */
    public Reference at(String path) {
        return new Reference(resourceId, path);
    }

    private Reference root() {
        return new Reference(resourceId, "");
    }

    @Override
    public String toString() {
        return "ResourceRef[" + resourceId + "]";
    }
}
