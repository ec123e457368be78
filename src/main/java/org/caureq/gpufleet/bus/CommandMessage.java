package org.caureq.gpufleet.bus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.caureq.gpufleet.domain.Instance;

import java.util.UUID;

/** Flat command envelope published on the orchestrator channel. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandMessage(
        @JsonProperty("type") String type,
        @JsonProperty("instance_id") UUID instanceId,
        @JsonProperty("zone") String zone,
        @JsonProperty("instance_type") String instanceType,
        @JsonProperty("provider") String provider,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("reason") String reason,
        @JsonProperty("correlation_id") String correlationId
) {

    public static CommandMessage provision(Instance inst, String correlationId) {
        return new CommandMessage(CommandType.PROVISION.wire(), inst.getId(), inst.getZone(), inst.getInstanceType(),
                inst.getProvider(), inst.getModelId(), null, correlationId);
    }

    public static CommandMessage terminate(UUID instanceId, String reason, String correlationId) {
        return new CommandMessage(CommandType.TERMINATE.wire(), instanceId, null, null, null, null, reason,
                correlationId);
    }

    public static CommandMessage of(CommandType type, String correlationId) {
        return new CommandMessage(type.wire(), null, null, null, null, null, null, correlationId);
    }
}
