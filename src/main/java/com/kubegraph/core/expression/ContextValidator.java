package com.kubegraph.core.expression;

import com.kubegraph.core.reference.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * Context-specific checks run after parsing, e.g. "a readiness condition must read as boolean".
 * Findings are advisory unless the caller compiles in strict mode.
 */
public class ContextValidator {

    public List<Diagnostic> validate(Expr expr, List<Reference> references, ExpressionContext context) {
        var diagnostics = new ArrayList<Diagnostic>();
        switch (context) {
            case BOOLEAN -> {
                if (!ExpressionTypes.isBoolean(expr) && !ExpressionTypes.isReferenceAccess(expr)) {
                    diagnostics.add(Diagnostic.warning("EXPECTED_BOOLEAN",
                            "Expression should read as boolean", expr.span()));
                }
            }
            case STATUS_FIELD -> {
                for (Reference ref : references) {
                    if (!ref.isSchema() && !ref.isStatusField() && !ref.fieldPath().startsWith("metadata")) {
                        diagnostics.add(Diagnostic.warning("NON_STATUS_REFERENCE",
                                "Status projection reads '" + ref.toCelPath()
                                        + "', which is not a status field", expr.span()));
                    }
                }
            }
            case ANY -> {
                // no context constraints
            }
        }
        return diagnostics;
    }
}
