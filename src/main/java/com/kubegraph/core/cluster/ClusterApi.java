package com.kubegraph.core.cluster;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Typed-object access to the cluster, injected into the engine. Implementations throw
 * {@link ClusterApiException} with the HTTP status code on failure.
 */
public interface ClusterApi {

    /** Reads an object; throws with status 404 when it does not exist. */
    ObjectNode get(ResourceKey key);

    ObjectNode create(ObjectNode manifest);

    /** Full replace; the manifest must carry the live {@code metadata.resourceVersion}. */
    ObjectNode replace(ObjectNode manifest);

    void delete(ResourceKey key);

    List<ObjectNode> list(String apiVersion, String kind, String namespace);

    /** Server version string, used to check that the cluster is reachable. */
    String version();
}
