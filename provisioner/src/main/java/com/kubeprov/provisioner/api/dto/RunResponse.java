package com.kubeprov.provisioner.api.dto;

import com.kubeprov.provisioner.model.ProvisioningRun;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 */
public record RunResponse(
        UUID    id,
        String  provider,
        String  clusterId,
        String  clusterName,
        String  region,
        String  state,
        String  failedStep,
        String  errorMessage,
        int     rollbackFailures,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        Instant updatedAt
) {
    public static RunResponse from(ProvisioningRun run) {
        return new RunResponse(
                run.getId(),
                run.getProvider().id(),
                run.getClusterId(),
                run.getClusterName(),
                run.getRegion(),
                run.getState().name(),
                run.getFailedStep(),
                run.getErrorMessage(),
                run.getRollbackFailures(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getFinishedAt(),
                run.getUpdatedAt()
        );
    }
}
