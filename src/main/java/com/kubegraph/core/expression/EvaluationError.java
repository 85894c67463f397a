package com.kubegraph.core.expression;

import com.kubegraph.core.KubegraphException;

/**
 * An expression could not be evaluated in process, e.g. a property read on {@code null}.
 */
public class EvaluationError extends KubegraphException {
    public EvaluationError(String message) {
        super(message);
    }

    public EvaluationError(String message, Throwable cause) {
        super(message, cause);
    }
}
