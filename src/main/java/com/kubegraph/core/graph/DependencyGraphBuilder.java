package com.kubegraph.core.graph;

import com.kubegraph.core.ConstructionError;
import com.kubegraph.core.expression.DetectionResult;
import com.kubegraph.core.expression.ReferenceDetector;
import com.kubegraph.core.model.GraphResource;
import com.kubegraph.core.model.ResourceGraph;
import com.kubegraph.core.reference.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Builds a {@link DependencyGraph} from the references embedded in a graph's resources.
 *
 * <p>Every reference with a concrete in-graph resource id becomes an edge. Input-spec references
 * add no edge. References to ids outside the graph are recorded as external and left out of
 * leveling. The status projection is scanned too so that its references are validated, but
 * nothing depends on it, so it contributes no edges.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);
    private static final Pattern RESOURCE_ID = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final ReferenceDetector detector;

    public DependencyGraphBuilder() {
        this(new ReferenceDetector());
    }

    public DependencyGraphBuilder(ReferenceDetector detector) {
        this.detector = detector;
    }

    public DependencyGraph build(ResourceGraph graph) {
        graph.externals().keySet().forEach(DependencyGraphBuilder::requireIdentifier);
        return build(graph.resources(), graph.statusProjection());
    }

    /**
     * @throws ConstructionError on duplicate ids, ids that are not CEL identifiers, or a dependency cycle
     */
    public DependencyGraph build(List<GraphResource> resources, Map<String, Object> statusProjection) {
        var ids = new LinkedHashSet<String>();
        for (GraphResource resource : resources) {
            requireIdentifier(resource.id());
            if (!ids.add(resource.id())) {
                throw new ConstructionError("Duplicate resource id: " + resource.id(), List.of(resource.id()));
            }
        }

        var dependencies = new LinkedHashMap<String, Set<String>>();
        var edges = new ArrayList<DependencyGraph.Edge>();
        var external = new LinkedHashSet<Reference>();

        for (GraphResource resource : resources) {
            var deps = new LinkedHashSet<String>();
            DetectionResult detection = detector.detect(resource.manifest());
            for (Reference ref : detection.references()) {
                if (ref.isSchema()) {
                    continue;
                }
                if (!ids.contains(ref.resourceId())) {
                    log.warn("Resource '{}' references '{}' which is not part of the graph; treating it as external",
                            resource.id(), ref.toCelPath());
                    external.add(ref);
                    continue;
                }
                if (deps.add(ref.resourceId())) {
                    edges.add(new DependencyGraph.Edge(resource.id(), ref.resourceId()));
                }
            }
            dependencies.put(resource.id(), deps);
        }

        if (statusProjection != null && !statusProjection.isEmpty()) {
            for (Reference ref : detector.detect(statusProjection).references()) {
                if (!ref.isSchema() && !ids.contains(ref.resourceId())) {
                    log.warn("Status projection references '{}' which is not part of the graph", ref.toCelPath());
                    external.add(ref);
                }
            }
        }

        List<String> cycle = findCycle(dependencies);
        if (!cycle.isEmpty()) {
            throw new ConstructionError("Circular dependency detected: " + String.join(" -> ", cycle),
                    cycle.subList(0, cycle.size() - 1));
        }

        Map<String, Integer> levelById = computeLevels(dependencies);
        var nodes = new LinkedHashMap<String, ResourceNode>();
        for (GraphResource resource : resources) {
            nodes.put(resource.id(), new ResourceNode(resource.id(), resource.kind(), resource.manifest(),
                    dependencies.get(resource.id()), levelById.get(resource.id())));
        }

        int maxLevel = levelById.values().stream().mapToInt(Integer::intValue).max().orElse(-1);
        var levels = new ArrayList<List<String>>();
        for (int level = 0; level <= maxLevel; level++) {
            var members = new TreeSet<String>();
            for (var entry : levelById.entrySet()) {
                if (entry.getValue() == level) {
                    members.add(entry.getKey());
                }
            }
            levels.add(new ArrayList<>(members));
        }

        log.debug("Built dependency graph: {} resources, {} edges, {} levels",
                nodes.size(), edges.size(), levels.size());
        return new DependencyGraph(nodes, edges, levels, external);
    }

    /**
     * Depth-first search with a recursion stack. Returns the cycle as a closed path
     * ({@code a, b, a}) or an empty list.
     */
    static List<String> findCycle(Map<String, Set<String>> dependencies) {
        var visited = new HashSet<String>();
        var stack = new ArrayList<String>();
        var onStack = new HashSet<String>();
        for (String id : dependencies.keySet()) {
            List<String> cycle = visit(id, dependencies, visited, stack, onStack);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        return Collections.emptyList();
    }

    private static List<String> visit(String id, Map<String, Set<String>> dependencies, Set<String> visited,
                                      List<String> stack, Set<String> onStack) {
        if (onStack.contains(id)) {
            var cycle = new ArrayList<>(stack.subList(stack.indexOf(id), stack.size()));
            cycle.add(id);
            return cycle;
        }
        if (!visited.add(id)) {
            return Collections.emptyList();
        }
        stack.add(id);
        onStack.add(id);
        for (String dep : dependencies.getOrDefault(id, Set.of())) {
            List<String> cycle = visit(dep, dependencies, visited, stack, onStack);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        stack.remove(stack.size() - 1);
        onStack.remove(id);
        return Collections.emptyList();
    }

    /**
     * Assigns levels in passes: a resource is placed once all of its dependencies are placed,
     * one level above the deepest of them. Assumes the graph is acyclic.
     */
    static Map<String, Integer> computeLevels(Map<String, Set<String>> dependencies) {
        var levels = new HashMap<String, Integer>();
        while (levels.size() < dependencies.size()) {
            boolean progressed = false;
            for (var entry : dependencies.entrySet()) {
                String id = entry.getKey();
                if (levels.containsKey(id) || !levels.keySet().containsAll(entry.getValue())) {
                    continue;
                }
                int level = entry.getValue().stream().mapToInt(levels::get).map(l -> l + 1).max().orElse(0);
                levels.put(id, level);
                progressed = true;
            }
            if (!progressed) {
                throw new ConstructionError("Unable to order resources; unresolved dependencies remain");
            }
        }
        return levels;
    }

    /** Ids appear as {@code resources.<id>} in CEL, so {@code web-svc} would read as a subtraction. */
    private static void requireIdentifier(String id) {
        if (id == null || !RESOURCE_ID.matcher(id).matches()) {
            throw new ConstructionError("Resource id '" + id + "' is not a valid identifier; use letters, digits "
                    + "and underscores, starting with a letter (e.g. webSvc)", id == null ? List.of() : List.of(id));
        }
    }
}
