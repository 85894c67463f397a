package com.kubegraph.core.graph;

import com.kubegraph.core.reference.Reference;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Acyclic graph of resources with its level partition. Every edge endpoint is a node; edges point
 * from dependent to dependency.
 */
public class DependencyGraph {

    /** Directed edge {@code dependent -> dependency}. */
    public record Edge(String from, String to) {}

    private final Map<String, ResourceNode> nodes;
    private final List<Edge> edges;
    private final List<List<String>> levels;
    private final Set<Reference> externalReferences;

    DependencyGraph(Map<String, ResourceNode> nodes, List<Edge> edges, List<List<String>> levels,
                    Set<Reference> externalReferences) {
        this.nodes = new LinkedHashMap<>(nodes);
        this.edges = List.copyOf(edges);
        var copy = new ArrayList<List<String>>();
        levels.forEach(level -> copy.add(List.copyOf(level)));
        this.levels = List.copyOf(copy);
        this.externalReferences = new LinkedHashSet<>(externalReferences);
    }

    public ResourceNode node(String id) {
        return nodes.get(id);
    }

    public Collection<ResourceNode> nodes() {
        return nodes.values();
    }

    public List<Edge> edges() {
        return edges;
    }

    /** Level partition in ascending order; ids within a level are sorted. */
    public List<List<String>> levels() {
        return levels;
    }

    public int levelOf(String id) {
        ResourceNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown resource: " + id);
        }
        return node.level();
    }

    /** References to resources declared outside this graph; never waited on. */
    public Set<Reference> externalReferences() {
        return Set.copyOf(externalReferences);
    }

    public Set<String> dependenciesOf(String id) {
        ResourceNode node = nodes.get(id);
        return node == null ? Set.of() : node.dependencies();
    }

    public Set<String> dependentsOf(String id) {
        var result = new LinkedHashSet<String>();
        for (Edge edge : edges) {
            if (edge.to().equals(id)) {
                result.add(edge.from());
            }
        }
        return result;
    }

    /** Every resource that depends on {@code id}, directly or through other resources. */
    public Set<String> transitiveDependentsOf(String id) {
        var result = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>(dependentsOf(id));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (result.add(next)) {
                queue.addAll(dependentsOf(next));
            }
        }
        return result;
    }

    /** Flattened level order: a valid creation order. */
    public List<String> topologicalOrder() {
        var order = new ArrayList<String>();
        levels.forEach(order::addAll);
        return order;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
