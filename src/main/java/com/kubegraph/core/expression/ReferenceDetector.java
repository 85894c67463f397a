package com.kubegraph.core.expression;

import com.kubegraph.core.ConstructionError;
import com.kubegraph.core.reference.FieldPaths;
import com.kubegraph.core.reference.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Finds every {@link Reference} reachable from an arbitrary value: nested maps, lists, arrays,
 * expression trees and strings carrying {@code ${...}} interpolations.
 *
 * <p>The walk is bounded by a maximum depth and an identity visited-set, so self-referencing
 * object graphs terminate. Pure and idempotent.
 */
public class ReferenceDetector {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDetector.class);

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final int maxDepth;

    public ReferenceDetector() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ReferenceDetector(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public DetectionResult detect(Object value) {
        var walk = new Walk();
        walk.visit(value, 0);
        if (walk.found.isEmpty()) {
            return walk.truncated ? new DetectionResult(false, List.of(), true) : DetectionResult.NONE;
        }
        return new DetectionResult(true, new ArrayList<>(walk.found), walk.truncated);
    }

    public boolean hasReferences(Object value) {
        return detect(value).hasReferences();
    }

    /** Recognizes the serialized marker form {@code {__ref__: true, __resourceId__, __fieldPath__}}. */
    static Reference markerReference(Map<?, ?> map) {
        if (Boolean.TRUE.equals(map.get("__ref__")) && map.get("__resourceId__") instanceof String id) {
            Object path = map.get("__fieldPath__");
            return new Reference(id, path == null ? "" : path.toString());
        }
        return null;
    }

    private final class Walk {
        private final Set<Reference> found = new LinkedHashSet<>();
        private final Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        private boolean truncated;

        void visit(Object value, int depth) {
            if (value == null) {
                return;
            }
            if (depth > maxDepth) {
                truncated = true;
                return;
            }
            if (value instanceof Reference ref) {
                record(ref);
            } else if (value instanceof String text) {
                visitString(text, depth);
            } else if (value instanceof Expr expr) {
                if (visited.add(expr)) {
                    visitExpr(expr, depth);
                }
            } else if (value instanceof Map<?, ?> map) {
                if (!visited.add(map)) {
                    return;
                }
                Reference marker = markerReference(map);
                if (marker != null) {
                    record(marker);
                    return;
                }
                for (Object entry : map.values()) {
                    visit(entry, depth + 1);
                }
            } else if (value instanceof Iterable<?> iterable) {
                if (!visited.add(iterable)) {
                    return;
                }
                for (Object item : iterable) {
                    visit(item, depth + 1);
                }
            } else if (value instanceof Object[] array) {
                if (!visited.add(array)) {
                    return;
                }
                for (Object item : array) {
                    visit(item, depth + 1);
                }
            }
        }

        private void visitString(String text, int depth) {
            if (!ExpressionParser.containsInterpolation(text)) {
                return;
            }
            Expr parsed;
            try {
                parsed = ExpressionParser.parseInterpolated(text);
            } catch (CompileError e) {
                log.debug("Treating '{}' as plain text: {}", text, e.getMessage());
                return;
            }
            visitExpr(parsed, depth);
        }

        private void visitExpr(Expr expr, int depth) {
            if (depth > maxDepth) {
                truncated = true;
                return;
            }
            int next = depth + 1;
            if (expr instanceof Expr.FieldRef ref) {
                record(ref.reference());
            } else if (expr instanceof Expr.Member member) {
                visitExpr(member.object(), next);
            } else if (expr instanceof Expr.Index index) {
                visitExpr(index.object(), next);
                visitExpr(index.index(), next);
            } else if (expr instanceof Expr.Call call) {
                visitExpr(call.callee(), next);
                call.arguments().forEach(arg -> visitExpr(arg, next));
            } else if (expr instanceof Expr.Unary unary) {
                visitExpr(unary.operand(), next);
            } else if (expr instanceof Expr.Binary binary) {
                visitExpr(binary.left(), next);
                visitExpr(binary.right(), next);
            } else if (expr instanceof Expr.Conditional conditional) {
                visitExpr(conditional.test(), next);
                visitExpr(conditional.consequent(), next);
                visitExpr(conditional.alternate(), next);
            } else if (expr instanceof Expr.Template template) {
                template.expressions().forEach(e -> visitExpr(e, next));
            } else if (expr instanceof Expr.ArrayLiteral array) {
                array.elements().forEach(e -> visitExpr(e, next));
            } else if (expr instanceof Expr.Lambda lambda) {
                visitExpr(lambda.body(), next);
            }
        }

        private void record(Reference ref) {
            for (String segment : FieldPaths.segments(ref.fieldPath())) {
                if (Reference.MARKER_KEYS.contains(segment)) {
                    throw new ConstructionError("Field path '" + ref.fieldPath() + "' of resource '"
                            + ref.resourceId() + "' uses reserved key '" + segment + "'",
                            List.of(ref.resourceId()));
                }
            }
            found.add(ref);
        }
    }
}
