package org.caureq.gpufleet.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.api.error.ApiException;
import org.caureq.gpufleet.bus.CommandMessage;
import org.caureq.gpufleet.bus.CommandPublisher;
import org.caureq.gpufleet.bus.CommandType;
import org.caureq.gpufleet.domain.ActionStatus;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.jobs.JobRunner;
import org.caureq.gpufleet.service.jobs.ProvisioningJob;
import org.caureq.gpufleet.service.jobs.TerminatorJob;
import org.caureq.gpufleet.service.lifecycle.InstanceTransitions;
import org.caureq.gpufleet.service.provider.ProviderRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.UUID;

/**
 * Operator intents. Each one is written to the ledger first and only then
 * announced on the bus, so losing the message never loses the intent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstanceCommandService {
    public static final String ADMIN_TERMINATE_REASON = "admin_request";

    private final InstanceRepo repo;
    private final ProviderRegistry providers;
    private final InstanceTransitions transitions;
    private final ActionLogService actionLog;
    private final BootstrapScriptRenderer bootstrap;
    private final CommandPublisher publisher;
    private final ProvisioningJob provisioningJob;
    private final TerminatorJob terminatorJob;
    private final CatalogSyncService catalog;
    private final ReconciliationService reconciliation;
    private final JobRunner runner;
    private final Clock clock;

    public record ProvisionRequest(String provider, String zone, String instanceType, String modelId,
                                   String imageId, Integer dataVolumeGb) {}

    public Instance requestProvision(ProvisionRequest req, String correlationId) {
        if (!providers.has(req.provider())) {
            throw new IllegalArgumentException("Provider '" + req.provider() + "' is not enabled");
        }
        var inst = repo.save(Instance.builder()
                .provider(req.provider().toLowerCase())
                .zone(req.zone())
                .instanceType(req.instanceType())
                .modelId(req.modelId())
                .imageId(req.imageId())
                .dataVolumeGb(req.dataVolumeGb())
                .status(InstanceStatus.PROVISIONING)
                .createdAt(clock.instant())
                .build());
        var meta = new HashMap<String, Object>();
        meta.put("provider", inst.getProvider());
        meta.put("zone", inst.getZone());
        meta.put("instance_type", inst.getInstanceType());
        if (inst.getModelId() != null) meta.put("model_id", inst.getModelId());
        if (correlationId != null) meta.put("correlation_id", correlationId);
        actionLog.record("INSTANCE_CREATED", inst.getId(), null, InstanceStatus.PROVISIONING, ActionStatus.SUCCESS,
                null, null, meta);
        log.info("instance {}: provisioning requested ({} {} {})", inst.getId(), inst.getProvider(),
                inst.getZone(), inst.getInstanceType());
        if (!publisher.publish(CommandMessage.provision(inst, correlationId))) {
            provisioningJob.runNow(inst.getId());
        }
        return inst;
    }

    /**
     * Idempotent: an instance already terminating (or gone) is returned as is.
     */
    public Instance requestTermination(UUID instanceId, String reason, String correlationId) {
        var inst = load(instanceId);
        var effective = reason == null || reason.isBlank() ? ADMIN_TERMINATE_REASON : reason;
        if (inst.getStatus() == InstanceStatus.TERMINATED || inst.getStatus() == InstanceStatus.ARCHIVED) {
            return inst;
        }
        if (!markTerminating(inst, effective)) {
            throw ApiException.invalidTransition(instanceId, load(instanceId).getStatus().code(), "terminate");
        }
        if (!publisher.publish(CommandMessage.terminate(instanceId, effective, correlationId))) {
            terminatorJob.runNow(instanceId);
        }
        return load(instanceId);
    }

    /** @return true when the instance is terminating after this call */
    public boolean markTerminating(Instance inst, String reason) {
        if (inst.getStatus() == InstanceStatus.TERMINATING) return true;
        if (transitions.requestTermination(inst, reason, null, null)) return true;
        var now = repo.findById(inst.getId()).map(Instance::getStatus).orElse(null);
        if (now != InstanceStatus.TERMINATING) {
            log.info("instance {}: terminate ignored in status {}", inst.getId(), now);
        }
        return now == InstanceStatus.TERMINATING;
    }

    public Instance drain(UUID instanceId) {
        var inst = load(instanceId);
        if (inst.getStatus() == InstanceStatus.DRAINING) return inst;
        if (!transitions.toDraining(inst)) {
            throw ApiException.invalidTransition(instanceId, inst.getStatus().code(), "drain");
        }
        return load(instanceId);
    }

    public Instance archive(UUID instanceId) {
        var inst = load(instanceId);
        if (inst.getStatus() == InstanceStatus.ARCHIVED) return inst;
        if (!transitions.archive(inst)) {
            throw ApiException.invalidTransition(instanceId, inst.getStatus().code(), "archive");
        }
        return load(instanceId);
    }

    /**
     * New boot attempt on the same server: restarts the startup clock, clears
     * worker liveness and pushes the bootstrap again. The status stays booting.
     */
    public Instance reinstall(UUID instanceId) {
        var inst = load(instanceId);
        if (inst.getStatus() != InstanceStatus.BOOTING
                || repo.restartBoot(instanceId, InstanceStatus.BOOTING, clock.instant()) == 0) {
            throw ApiException.invalidTransition(instanceId, inst.getStatus().code(), "reinstall");
        }
        var meta = new HashMap<String, Object>();
        meta.put("previous_boot_started_at", String.valueOf(inst.getBootStartedAt()));
        actionLog.record("INSTANCE_REINSTALL", instanceId, InstanceStatus.BOOTING, InstanceStatus.BOOTING,
                ActionStatus.SUCCESS, null, null, meta);

        if (inst.getProviderInstanceId() != null && inst.getZone() != null) {
            var provider = providers.get(inst.getProvider());
            var script = bootstrap.render(inst);
            var pushMeta = new HashMap<String, Object>();
            pushMeta.put("provider_instance_id", inst.getProviderInstanceId());
            pushMeta.put("reinstall", true);
            actionLog.tracedRun("PROVIDER_BOOTSTRAP", inst, pushMeta,
                    () -> provider.pushBootstrap(inst.getZone(), inst.getProviderInstanceId(), script));
        }
        log.info("instance {}: reinstall started", instanceId);
        return load(instanceId);
    }

    /** @return true when the command went out on the bus, false when it runs locally */
    public boolean requestCatalogSync(String correlationId) {
        if (publisher.publish(CommandMessage.of(CommandType.SYNC_CATALOG, correlationId))) return true;
        runner.submit("catalog-sync", catalog::syncAll);
        return false;
    }

    public boolean requestReconcile(String correlationId) {
        if (publisher.publish(CommandMessage.of(CommandType.RECONCILE, correlationId))) return true;
        runner.submit("reconcile", reconciliation::fullReconcile);
        return false;
    }

    private Instance load(UUID instanceId) {
        return repo.findById(instanceId).orElseThrow(() -> ApiException.notFound(instanceId));
    }
}
