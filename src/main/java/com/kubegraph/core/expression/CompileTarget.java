package com.kubegraph.core.expression;

/**
 * Emission target. Detection is shared; only what is produced differs.
 */
public enum CompileTarget {
    /** CEL text evaluated later by the control-loop delegate. */
    CEL,
    /** The original value is kept and resolved by substitution during a direct deploy. */
    DIRECT
}
