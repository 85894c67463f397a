package com.kubegraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A resource the deploy applied (or tried to apply).
 *
 * @param manifest   the manifest sent to the cluster, references substituted
 * @param deployedAt when the apply succeeded; null if it never did
 * @param error      failure message when {@code status} is {@link ResourceStatus#FAILED}
 */
public record DeployedResource(String id,
                               String kind,
                               String name,
                               String namespace,
                               JsonNode manifest,
                               ResourceStatus status,
                               Instant deployedAt,
                               String error) {

    public DeployedResource withStatus(ResourceStatus newStatus) {
        return new DeployedResource(id, kind, name, namespace, manifest, newStatus, deployedAt, error);
    }

    public DeployedResource failed(String message) {
        return new DeployedResource(id, kind, name, namespace, manifest, ResourceStatus.FAILED, deployedAt, message);
    }

    public boolean isApplied() {
        return deployedAt != null;
    }
}
