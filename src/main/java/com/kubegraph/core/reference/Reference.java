package com.kubegraph.core.reference;

import java.util.Objects;
import java.util.Set;

/**
 * Marker standing in for "field {@code fieldPath} of resource {@code resourceId}" while a graph is
 * being assembled. The live value only exists once the resource is running.
 *
 * @param resourceId concrete resource id, or {@link #SCHEMA_ID} for the graph's own input spec
 * @param fieldPath  dotted path with optional {@code [n]} index segments, e.g. {@code status.podIP}
 * @param valueType  expected Java type of the resolved value ({@code Object} when unknown)
 */
public record Reference(String resourceId, String fieldPath, Class<?> valueType) {

    /** Sentinel id for references into the graph's input spec. */
    public static final String SCHEMA_ID = "__schema__";

    /** Keys reserved for the serialized marker form; an author path may not use them. */
    public static final Set<String> MARKER_KEYS = Set.of("__ref__", "__resourceId__", "__fieldPath__");

    public Reference {
        Objects.requireNonNull(resourceId, "resourceId");
        fieldPath = fieldPath == null ? "" : fieldPath;
        valueType = valueType == null ? Object.class : valueType;
    }

    public Reference(String resourceId, String fieldPath) {
        this(resourceId, fieldPath, Object.class);
    }

    public static Reference schema(String fieldPath) {
        return new Reference(SCHEMA_ID, fieldPath);
    }

    public boolean isSchema() {
        return SCHEMA_ID.equals(resourceId);
    }

    /** Composes a child path; reading a field of a field never throws. */
    public Reference field(String name) {
        if (name == null || name.isEmpty()) {
            return this;
        }
        return new Reference(resourceId, fieldPath.isEmpty() ? name : fieldPath + "." + name, Object.class);
    }

    public Reference index(int index) {
        return new Reference(resourceId, fieldPath + "[" + index + "]", Object.class);
    }

    public Reference as(Class<?> type) {
        return new Reference(resourceId, fieldPath, type);
    }

    /**
     * Path as the control-loop target addresses it: {@code schema.<path>} for the input spec,
     * {@code resources.<id>.<path>} otherwise.
     */
    public String toCelPath() {
        String root = isSchema() ? "schema" : "resources." + resourceId;
        return fieldPath.isEmpty() ? root : root + "." + fieldPath;
    }

    /** True when the path reads from the object's observed status. */
    public boolean isStatusField() {
        return fieldPath.equals("status") || fieldPath.startsWith("status.") || fieldPath.startsWith("status[");
    }

    @Override
    public String toString() {
        return toCelPath();
    }
}
