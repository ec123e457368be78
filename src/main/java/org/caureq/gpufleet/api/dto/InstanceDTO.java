package org.caureq.gpufleet.api.dto;

import org.caureq.gpufleet.domain.Instance;

import java.time.Instant;
import java.util.UUID;

public record InstanceDTO(
        UUID id, String provider, String zone, String instanceType, String modelId,
        String status, String providerInstanceId, String ipAddress,
        String workerStatus, Instant workerLastHeartbeat, Integer workerInferencePort,
        Integer workerQueueDepth, Double workerGpuUtilization,
        Instant createdAt, Instant bootStartedAt, Instant readyAt, Instant terminatedAt,
        int retryCount, Instant nextRetryAt, String errorCode, String errorMessage,
        String deletionReason, boolean deletedByProvider, boolean archived
) {
    public static InstanceDTO from(Instance i) {
        return new InstanceDTO(i.getId(), i.getProvider(), i.getZone(), i.getInstanceType(), i.getModelId(),
                i.getStatus() == null ? null : i.getStatus().code(), i.getProviderInstanceId(), i.getIpAddress(),
                i.getWorkerStatus(), i.getWorkerLastHeartbeat(), i.getWorkerInferencePort(),
                i.getWorkerQueueDepth(), i.getWorkerGpuUtilization(),
                i.getCreatedAt(), i.getBootStartedAt(), i.getReadyAt(), i.getTerminatedAt(),
                i.getRetryCount(), i.getNextRetryAt(), i.getErrorCode(), i.getErrorMessage(),
                i.getDeletionReason(), i.isDeletedByProvider(), i.isArchived());
    }
}
