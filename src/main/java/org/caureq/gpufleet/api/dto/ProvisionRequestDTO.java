package org.caureq.gpufleet.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record ProvisionRequestDTO(
        @NotBlank String provider,
        @NotBlank String zone,
        @NotBlank String instanceType,
        String modelId,
        String imageId,
        @Positive Integer dataVolumeGb
) {}
