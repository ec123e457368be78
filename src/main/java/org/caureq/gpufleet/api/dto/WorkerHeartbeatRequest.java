package org.caureq.gpufleet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.Map;
import java.util.UUID;

public record WorkerHeartbeatRequest(
        @JsonProperty("instance_id") @NotNull UUID instanceId,
        @JsonProperty("status") @NotBlank String status,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("health_port") @Min(1) @Max(65535) Integer healthPort,
        @JsonProperty("inference_port") @Min(1) @Max(65535) Integer inferencePort,
        @JsonProperty("queue_depth") @PositiveOrZero Integer queueDepth,
        @JsonProperty("gpu_utilization") @DecimalMin("0.0") @DecimalMax("100.0") Double gpuUtilization,
        @JsonProperty("metadata") Map<String, Object> metadata
) {}
