package com.kubegraph.core.cluster;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Identity of a cluster object.
 *
 * @param namespace null for cluster-scoped kinds
 */
public record ResourceKey(String apiVersion, String kind, String namespace, String name) {

    /**
     * Key of a manifest, falling back to {@code defaultNamespace} for namespaced kinds that do
     * not name one.
     */
    public static ResourceKey of(JsonNode manifest, String defaultNamespace) {
        String apiVersion = manifest.path("apiVersion").asText("v1");
        String kind = manifest.path("kind").asText("");
        String name = manifest.path("metadata").path("name").asText(null);
        String namespace = manifest.path("metadata").path("namespace").asText(null);
        if (KubernetesPaths.isClusterScoped(kind)) {
            namespace = null;
        } else if (namespace == null || namespace.isEmpty()) {
            namespace = defaultNamespace;
        }
        return new ResourceKey(apiVersion, kind, namespace, name);
    }

    @Override
    public String toString() {
        return kind + " " + (namespace == null ? "" : namespace + "/") + name;
    }
}
