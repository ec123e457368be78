package org.caureq.gpufleet.api.dto;

import org.caureq.gpufleet.domain.InstanceVolume;

import java.time.Instant;
import java.util.UUID;

public record VolumeDTO(
        UUID id, String providerVolumeId, String name, String volumeType, Long sizeBytes,
        boolean deleteOnTerminate, String status, Instant createdAt, Instant deletedAt, String errorMessage
) {
    public static VolumeDTO from(InstanceVolume v) {
        return new VolumeDTO(v.getId(), v.getProviderVolumeId(), v.getName(),
                v.getVolumeType() == null ? null : v.getVolumeType().name().toLowerCase(),
                v.getSizeBytes(), v.isDeleteOnTerminate(),
                v.getStatus() == null ? null : v.getStatus().code(),
                v.getCreatedAt(), v.getDeletedAt(), v.getErrorMessage());
    }
}
