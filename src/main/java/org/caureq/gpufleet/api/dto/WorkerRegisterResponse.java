package org.caureq.gpufleet.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/** {@code token} is present only on the call that issued it. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerRegisterResponse(
        @JsonProperty("instance_id") UUID instanceId,
        @JsonProperty("token") String token,
        @JsonProperty("status") String status
) {}
