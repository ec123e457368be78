package org.caureq.gpufleet.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.api.error.ApiException;
import org.caureq.gpufleet.api.error.ErrorCode;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.provider.MockCloudProvider;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Worker registration and heartbeats: the only writer of the worker liveness
 * columns. Lifecycle loops read them, they never write them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HeartbeatService {
    public static final String STARTING = "starting";

    private static final Set<InstanceStatus> STALE = EnumSet.of(InstanceStatus.TERMINATED, InstanceStatus.ARCHIVED,
            InstanceStatus.PROVISIONING_FAILED, InstanceStatus.STARTUP_FAILED);

    private final InstanceRepo repo;
    private final WorkerTokenService tokens;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /** What the worker reports; null fields keep the stored value. */
    public record WorkerReport(String status, String modelId, Integer healthPort, Integer inferencePort,
                               Integer queueDepth, Double gpuUtilization, Map<String, Object> metadata) {}

    /** {@code token} is only set when one was issued by this call. */
    public record Registration(UUID instanceId, String token) {}

    public Registration register(UUID instanceId, WorkerReport report, String bearer, String callerIp) {
        var inst = load(instanceId);
        rejectStale(inst);
        checkEndpoint(inst, report.inferencePort());

        String issued = null;
        var existing = tokens.activeToken(instanceId);
        if (existing.isPresent()) {
            if (!tokens.matches(existing.get(), bearer)) {
                throw ApiException.unauthorized("Worker token missing or invalid");
            }
            tokens.touch(instanceId);
        } else {
            if (!bootstrapping(inst, callerIp)) {
                log.warn("instance {}: first registration from {} refused (instance ip {})",
                        instanceId, callerIp, inst.getIpAddress());
                throw ApiException.unauthorized("First registration must come from the instance itself");
            }
            issued = tokens.issue(instanceId);
        }

        var status = inst.getWorkerStatus() != null ? inst.getWorkerStatus() : STARTING;
        write(inst, new WorkerReport(status, report.modelId(), report.healthPort(), report.inferencePort(),
                null, null, report.metadata()));
        log.info("instance {}: worker registered (model={})", instanceId, report.modelId());
        return new Registration(instanceId, issued);
    }

    public void heartbeat(UUID instanceId, WorkerReport report, String bearer) {
        var inst = load(instanceId);
        var token = tokens.activeToken(instanceId)
                .orElseThrow(() -> ApiException.unauthorized("No worker token issued for " + instanceId));
        if (!tokens.matches(token, bearer)) {
            throw ApiException.unauthorized("Worker token missing or invalid");
        }
        rejectStale(inst);
        checkEndpoint(inst, report.inferencePort());
        tokens.touch(instanceId);

        var status = report.status() == null ? null : report.status().trim().toLowerCase(Locale.ROOT);
        write(inst, new WorkerReport(status, report.modelId(), report.healthPort(), report.inferencePort(),
                report.queueDepth(), report.gpuUtilization(), report.metadata()));
        log.debug("instance {}: heartbeat status={} queue={}", instanceId, status, report.queueDepth());
    }

    private Instance load(UUID instanceId) {
        return repo.findById(instanceId).orElseThrow(() -> ApiException.notFound(instanceId));
    }

    private void rejectStale(Instance inst) {
        if (STALE.contains(inst.getStatus())) {
            throw new ApiException(HttpStatus.GONE, ErrorCode.STALE_INSTANCE,
                    "Instance " + inst.getId() + " is " + inst.getStatus().code(),
                    Map.of("status", inst.getStatus().code()));
        }
    }

    private boolean bootstrapping(Instance inst, String callerIp) {
        if (MockCloudProvider.NAME.equalsIgnoreCase(inst.getProvider())) return true;
        return callerIp != null && inst.getIpAddress() != null && callerIp.equals(inst.getIpAddress());
    }

    /** Two active instances must not claim the same ip:inference_port. */
    private void checkEndpoint(Instance inst, Integer reportedPort) {
        var port = reportedPort != null ? reportedPort : inst.getWorkerInferencePort();
        if (inst.getIpAddress() != null && port != null
                && repo.existsByIpAddressAndWorkerInferencePortAndStatusInAndIdNot(
                        inst.getIpAddress(), port, InstanceStatus.ACTIVE, inst.getId())) {
            throw new ApiException(HttpStatus.CONFLICT, ErrorCode.ENDPOINT_CONFLICT,
                    "Endpoint " + inst.getIpAddress() + ":" + port + " is already served by another instance");
        }
    }

    private void write(Instance inst, WorkerReport r) {
        repo.recordWorkerLiveness(inst.getId(), clock.instant(),
                r.status() != null ? r.status() : inst.getWorkerStatus(),
                r.modelId() != null ? r.modelId() : inst.getWorkerModelId(),
                r.healthPort() != null ? r.healthPort() : inst.getWorkerHealthPort(),
                r.inferencePort() != null ? r.inferencePort() : inst.getWorkerInferencePort(),
                r.queueDepth() != null ? r.queueDepth() : inst.getWorkerQueueDepth(),
                r.gpuUtilization() != null ? r.gpuUtilization() : inst.getWorkerGpuUtilization(),
                r.metadata() != null ? toJson(r.metadata()) : inst.getWorkerMetadata());
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("metadata is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
