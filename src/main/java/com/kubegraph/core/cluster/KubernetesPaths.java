package com.kubegraph.core.cluster;

import java.util.Map;
import java.util.Set;

/**
 * REST path rules: core group under {@code /api/v1}, named groups under
 * {@code /apis/<group>/<version>}, lowercase plural resource names.
 */
public final class KubernetesPaths {

    private static final Set<String> CLUSTER_SCOPED = Set.of(
            "Namespace", "Node", "PersistentVolume", "StorageClass", "CustomResourceDefinition",
            "ClusterRole", "ClusterRoleBinding", "PriorityClass", "IngressClass",
            "MutatingWebhookConfiguration", "ValidatingWebhookConfiguration", "ResourceGraphDefinition");

    private static final Map<String, String> IRREGULAR_PLURALS = Map.of(
            "Endpoints", "endpoints",
            "PodSecurityPolicy", "podsecuritypolicies");

    private KubernetesPaths() {}

    public static boolean isClusterScoped(String kind) {
        return CLUSTER_SCOPED.contains(kind);
    }

    static String plural(String kind) {
        String irregular = IRREGULAR_PLURALS.get(kind);
        if (irregular != null) {
            return irregular;
        }
        String lower = kind.toLowerCase();
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("ch") || lower.endsWith("sh")) {
            return lower + "es";
        }
        if (lower.endsWith("y") && lower.length() > 1 && "aeiou".indexOf(lower.charAt(lower.length() - 2)) < 0) {
            return lower.substring(0, lower.length() - 1) + "ies";
        }
        return lower + "s";
    }

    static String collection(String apiVersion, String kind, String namespace) {
        String base = apiVersion.contains("/") ? "/apis/" + apiVersion : "/api/" + apiVersion;
        if (namespace != null && !isClusterScoped(kind)) {
            base += "/namespaces/" + namespace;
        }
        return base + "/" + plural(kind);
    }

    static String object(ResourceKey key) {
        return collection(key.apiVersion(), key.kind(), key.namespace()) + "/" + key.name();
    }
}
