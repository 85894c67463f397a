package com.kubegraph.core.engine;

import com.kubegraph.core.model.DeploymentResult;

/**
 * One way of getting a graph onto the cluster. Implementations record per-resource outcomes
 * and errors in the context and never throw for resource failures.
 */
public interface DeploymentStrategy {

    DeploymentOptions.Strategy type();

    DeploymentResult deploy(DeploymentContext ctx);
}
