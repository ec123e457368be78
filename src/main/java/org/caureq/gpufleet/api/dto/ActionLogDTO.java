package org.caureq.gpufleet.api.dto;

import org.caureq.gpufleet.domain.ActionLog;

import java.time.Instant;
import java.util.UUID;

public record ActionLogDTO(
        UUID id, String actionType, String component, String status, UUID instanceId,
        String instanceStatusBefore, String instanceStatusAfter, Long durationMs,
        String errorCode, String errorMessage, String metadata, UUID parentLogId,
        Instant createdAt, Instant completedAt
) {
    public static ActionLogDTO from(ActionLog a) {
        return new ActionLogDTO(a.getId(), a.getActionType(), a.getComponent(),
                a.getStatus() == null ? null : a.getStatus().code(), a.getInstanceId(),
                a.getInstanceStatusBefore() == null ? null : a.getInstanceStatusBefore().code(),
                a.getInstanceStatusAfter() == null ? null : a.getInstanceStatusAfter().code(),
                a.getDurationMs(), a.getErrorCode(), a.getErrorMessage(), a.getMetadata(), a.getParentLogId(),
                a.getCreatedAt(), a.getCompletedAt());
    }
}
