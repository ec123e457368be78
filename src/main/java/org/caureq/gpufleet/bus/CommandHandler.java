package org.caureq.gpufleet.bus;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.CatalogSyncService;
import org.caureq.gpufleet.service.InstanceCommandService;
import org.caureq.gpufleet.service.ReconciliationService;
import org.caureq.gpufleet.service.jobs.JobRunner;
import org.caureq.gpufleet.service.jobs.ProvisioningJob;
import org.caureq.gpufleet.service.jobs.TerminatorJob;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Turns bus commands into ledger writes and job hand-offs. Nothing here is
 * authoritative: a lost message is picked up by the next tick of the loop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandHandler {
    static final String DEFAULT_TERMINATE_REASON = "terminate_command";

    private final InstanceRepo repo;
    private final InstanceCommandService commands;
    private final ProvisioningJob provisioningJob;
    private final TerminatorJob terminatorJob;
    private final CatalogSyncService catalog;
    private final ReconciliationService reconciliation;
    private final JobRunner runner;
    private final Clock clock;

    public void handle(CommandMessage message) {
        var type = CommandType.fromWire(message.type());
        if (type.isEmpty()) {
            log.warn("[Bus] unknown command type '{}', dropped", message.type());
            return;
        }
        switch (type.get()) {
            case PROVISION -> onProvision(message);
            case TERMINATE -> onTerminate(message);
            case SYNC_CATALOG -> runner.submit("catalog-sync", catalog::syncAll);
            case RECONCILE -> runner.submit("reconcile", reconciliation::fullReconcile);
            case REINSTALL -> onReinstall(message);
        }
    }

    private void onProvision(CommandMessage m) {
        if (m.instanceId() == null) {
            log.warn("[Bus] {} without instance_id, dropped", m.type());
            return;
        }
        if (!repo.existsById(m.instanceId())) {
            if (m.zone() == null || m.instanceType() == null) {
                log.warn("[Bus] {} for unknown instance {} lacks zone or instance_type, dropped", m.type(), m.instanceId());
                return;
            }
            repo.save(Instance.builder()
                    .id(m.instanceId())
                    .provider(m.provider() == null ? "mock" : m.provider())
                    .zone(m.zone())
                    .instanceType(m.instanceType())
                    .modelId(m.modelId())
                    .status(InstanceStatus.PROVISIONING)
                    .createdAt(clock.instant())
                    .build());
            log.info("instance {}: created from bus command", m.instanceId());
        }
        provisioningJob.runNow(m.instanceId());
    }

    private void onTerminate(CommandMessage m) {
        if (m.instanceId() == null) {
            log.warn("[Bus] {} without instance_id, dropped", m.type());
            return;
        }
        var inst = repo.findById(m.instanceId());
        if (inst.isEmpty()) {
            log.warn("[Bus] {} for unknown instance {}, dropped", m.type(), m.instanceId());
            return;
        }
        var reason = m.reason() == null ? DEFAULT_TERMINATE_REASON : m.reason();
        if (commands.markTerminating(inst.get(), reason)) {
            terminatorJob.runNow(m.instanceId());
        }
    }

    private void onReinstall(CommandMessage m) {
        if (m.instanceId() == null) {
            log.warn("[Bus] {} without instance_id, dropped", m.type());
            return;
        }
        runner.submit("reinstall:" + m.instanceId(), () -> commands.reinstall(m.instanceId()));
    }
}
