package com.kubegraph.core.model;

import java.util.List;

/**
 * Outcome of deleting a deployment's applied resources.
 *
 * @param rolledBack ids deleted (or already gone), in deletion order
 */
public record RollbackResult(String deploymentId,
                             List<String> rolledBack,
                             List<DeploymentError> errors,
                             DeploymentStatus status) {

    public RollbackResult {
        rolledBack = List.copyOf(rolledBack);
        errors = List.copyOf(errors);
    }

    public static RollbackResult of(String deploymentId, List<String> rolledBack, List<DeploymentError> errors) {
        DeploymentStatus status;
        if (errors.isEmpty()) {
            status = DeploymentStatus.SUCCESS;
        } else {
            status = rolledBack.isEmpty() ? DeploymentStatus.FAILED : DeploymentStatus.PARTIAL;
        }
        return new RollbackResult(deploymentId, rolledBack, errors, status);
    }
}
