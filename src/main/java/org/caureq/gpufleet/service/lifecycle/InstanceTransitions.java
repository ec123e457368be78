package org.caureq.gpufleet.service.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.domain.ActionStatus;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.ActionLogService;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies lifecycle decisions to the ledger. Each method issues one conditional
 * write against the status the caller read and, only when a row changed, one
 * ActionLog entry. {@code false} means the event no longer applies (already
 * handled, or another loop moved the instance first).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstanceTransitions {
    public static final String PROVIDER_DELETED_REASON = "provider_deleted";

    private final InstanceRepo repo;
    private final ActionLogService actionLog;
    private final Clock clock;

    public boolean toBooting(Instance inst) {
        return apply(inst, LifecycleEvent.PROVIDER_STARTED, "INSTANCE_BOOTING", ActionStatus.SUCCESS, null, null,
                meta("provider_instance_id", inst.getProviderInstanceId(), "ip_address", inst.getIpAddress()),
                to -> repo.startBoot(inst.getId(), inst.getStatus(), to, clock.instant()));
    }

    public boolean toProvisioningFailed(Instance inst, String code, String message) {
        return apply(inst, LifecycleEvent.PROVISIONING_FAILED, "INSTANCE_PROVISIONING_FAILED", ActionStatus.FAILED,
                code, message, meta("retry_count", inst.getRetryCount()),
                to -> repo.fail(inst.getId(), inst.getStatus(), to, code, message, clock.instant(), 0));
    }

    public boolean toReady(Instance inst) {
        return apply(inst, LifecycleEvent.WORKER_READY, "INSTANCE_READY", ActionStatus.SUCCESS, null, null,
                meta("worker_status", inst.getWorkerStatus(), "worker_inference_port", inst.getWorkerInferencePort()),
                to -> repo.markReady(inst.getId(), inst.getStatus(), to, clock.instant()));
    }

    public boolean toStartupFailed(Instance inst, String code, String message) {
        return apply(inst, LifecycleEvent.STARTUP_TIMED_OUT, "INSTANCE_STARTUP_FAILED", ActionStatus.FAILED,
                code, message, meta("boot_started_at", inst.getBootStartedAt(),
                        "health_check_failures", inst.getHealthCheckFailures() + 1),
                to -> repo.fail(inst.getId(), inst.getStatus(), to, code, message, clock.instant(), 1));
    }

    public boolean toDraining(Instance inst) {
        return apply(inst, LifecycleEvent.DRAIN_REQUESTED, "INSTANCE_DRAINING", ActionStatus.SUCCESS, null, null,
                Map.of(), to -> repo.moveStatus(inst.getId(), inst.getStatus(), to));
    }

    /**
     * Persists the wish to terminate. A reason or error already on the row wins
     * over the new one so the first cause stays visible.
     */
    public boolean requestTermination(Instance inst, String reason, String errorCode, String errorMessage) {
        var effectiveReason = inst.getDeletionReason() != null ? inst.getDeletionReason() : reason;
        var effectiveCode = errorCode != null ? errorCode : inst.getErrorCode();
        var effectiveMessage = errorCode != null ? errorMessage : inst.getErrorMessage();
        return apply(inst, LifecycleEvent.TERMINATE_REQUESTED, "INSTANCE_TERMINATION_REQUESTED", ActionStatus.SUCCESS,
                errorCode, errorMessage, meta("reason", effectiveReason),
                to -> repo.requestTermination(inst.getId(), List.of(inst.getStatus()), to,
                        effectiveReason, effectiveCode, effectiveMessage));
    }

    public boolean toTerminated(Instance inst) {
        return apply(inst, LifecycleEvent.TERMINATION_CONFIRMED, "TERMINATION_CONFIRMED", ActionStatus.SUCCESS,
                null, null, meta("provider_instance_id", inst.getProviderInstanceId()),
                to -> repo.confirmTerminated(inst.getId(), inst.getStatus(), to, clock.instant()));
    }

    /** Remote server vanished: terminal without any further provider call. */
    public boolean markProviderDeleted(Instance inst, String detectionMethod) {
        return apply(inst, LifecycleEvent.PROVIDER_DELETED, "PROVIDER_DELETED_DETECTED", ActionStatus.SUCCESS,
                null, null, meta("provider_instance_id", inst.getProviderInstanceId(),
                        "detection_method", detectionMethod),
                to -> repo.markProviderDeleted(inst.getId(), List.of(inst.getStatus()), to,
                        PROVIDER_DELETED_REASON, clock.instant()));
    }

    public boolean archive(Instance inst) {
        return apply(inst, LifecycleEvent.ARCHIVE_REQUESTED, "INSTANCE_ARCHIVED", ActionStatus.SUCCESS,
                null, null, Map.of(), to -> repo.archive(inst.getId(), inst.getStatus(), to));
    }

    private interface Write {
        int apply(InstanceStatus to);
    }

    private boolean apply(Instance inst, LifecycleEvent event, String actionType, ActionStatus logStatus,
                          String errorCode, String errorMessage, Map<String, Object> metadata, Write write) {
        var from = inst.getStatus();
        Optional<InstanceStatus> next = InstanceStateMachine.next(from, event);
        if (next.isEmpty()) {
            log.debug("instance {}: {} ignored in status {}", inst.getId(), event, from);
            return false;
        }
        var to = next.get();
        if (write.apply(to) == 0) {
            log.debug("instance {}: {} lost the race ({} is stale)", inst.getId(), event, from);
            return false;
        }
        actionLog.record(actionType, inst.getId(), from, to, logStatus, errorCode, errorMessage, metadata);
        log.info("instance {}: {} -> {} ({})", inst.getId(), from.code(), to.code(), event);
        return true;
    }

    private static Map<String, Object> meta(Object... kv) {
        var m = new HashMap<String, Object>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            var v = kv[i + 1];
            if (v != null) m.put(String.valueOf(kv[i]), v instanceof Instant ? v.toString() : v);
        }
        return m;
    }
}
