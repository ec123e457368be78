package org.caureq.gpufleet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Map;
import java.util.UUID;

public record WorkerRegisterRequest(
        @JsonProperty("instance_id") @NotNull UUID instanceId,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("health_port") @Min(1) @Max(65535) Integer healthPort,
        @JsonProperty("inference_port") @Min(1) @Max(65535) Integer inferencePort,
        @JsonProperty("metadata") Map<String, Object> metadata
) {}
