package com.kubegraph.core.model;

/**
 * Where in a deploy an error was raised.
 */
public enum DeploymentPhase {
    VALIDATION,
    APPLY,
    READINESS,
    DEPENDENCY,
    ROLLBACK,
    DEPLOYMENT
}
