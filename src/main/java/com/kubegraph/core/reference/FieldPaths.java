package com.kubegraph.core.reference;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsing and lookup of dotted field paths such as {@code spec.template.spec.containers[0].image}.
 */
public final class FieldPaths {

    private FieldPaths() {}

    /**
     * Splits a path into segments. Index segments are returned as their digits, so
     * {@code a.b[0].c} yields {@code [a, b, 0, c]}.
     */
    public static List<String> segments(String path) {
        var result = new ArrayList<String>();
        if (path == null || path.isEmpty()) {
            return result;
        }
        var current = new StringBuilder();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '.') {
                flush(current, result);
            } else if (c == '[') {
                flush(current, result);
                int close = path.indexOf(']', i);
                if (close < 0) {
                    current.append(path, i, path.length());
                    break;
                }
                result.add(path.substring(i + 1, close));
                i = close;
            } else {
                current.append(c);
            }
        }
        flush(current, result);
        return result;
    }

    /**
     * Reads a path from a live object. Returns empty when any segment is absent or null.
     */
    public static Optional<JsonNode> read(JsonNode root, String path) {
        JsonNode node = root;
        for (String segment : segments(path)) {
            if (node == null || node.isNull() || node.isMissingNode()) {
                return Optional.empty();
            }
            if (node.isArray()) {
                int index;
                try {
                    index = Integer.parseInt(segment);
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
                node = node.get(index);
            } else {
                node = node.get(segment);
            }
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(node);
    }

    private static void flush(StringBuilder current, List<String> result) {
        if (current.length() > 0) {
            result.add(current.toString());
            current.setLength(0);
        }
    }
}
