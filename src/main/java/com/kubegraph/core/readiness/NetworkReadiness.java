package com.kubegraph.core.readiness;

import com.fasterxml.jackson.databind.JsonNode;
import com.kubegraph.core.reference.FieldPaths;

import java.util.Map;

import static com.kubegraph.core.readiness.LiveObjects.textAt;

/**
 * Readiness for endpoint-exposing kinds.
 */
final class NetworkReadiness {

    private NetworkReadiness() {}

    /**
     * LoadBalancer services wait for an external address; ExternalName needs its target;
     * ClusterIP and NodePort are ready as soon as they exist.
     */
    static ReadinessVerdict service(JsonNode live) {
        String type = textAt(live, "spec.type", "ClusterIP");
        switch (type) {
            case "LoadBalancer": {
                String endpoint = firstIngressEndpoint(live);
                if (endpoint != null) {
                    return ReadinessVerdict.ready("LoadBalancer service has external endpoint " + endpoint,
                            Map.of("type", type, "endpoint", endpoint));
                }
                return ReadinessVerdict.notReady("LoadBalancerPending",
                        "Waiting for LoadBalancer external endpoint", Map.of("type", type));
            }
            case "ExternalName": {
                String externalName = textAt(live, "spec.externalName", null);
                if (externalName != null && !externalName.isEmpty()) {
                    return ReadinessVerdict.ready("ExternalName service points to " + externalName,
                            Map.of("type", type, "externalName", externalName));
                }
                return ReadinessVerdict.notReady("ExternalNameMissing",
                        "ExternalName service has no spec.externalName", Map.of("type", type));
            }
            default:
                return ReadinessVerdict.ready(type + " service is ready", Map.of("type", type));
        }
    }

    static ReadinessVerdict ingress(JsonNode live) {
        String endpoint = firstIngressEndpoint(live);
        if (endpoint != null) {
            return ReadinessVerdict.ready("Ingress has endpoint " + endpoint, Map.of("endpoint", endpoint));
        }
        return ReadinessVerdict.notReady("IngressPending", "Waiting for ingress controller to assign an address");
    }

    private static String firstIngressEndpoint(JsonNode live) {
        JsonNode ingress = FieldPaths.read(live, "status.loadBalancer.ingress").orElse(null);
        if (ingress == null || !ingress.isArray()) {
            return null;
        }
        for (JsonNode entry : ingress) {
            String ip = entry.path("ip").asText("");
            if (!ip.isEmpty()) {
                return ip;
            }
            String hostname = entry.path("hostname").asText("");
            if (!hostname.isEmpty()) {
                return hostname;
            }
        }
        return null;
    }
}
