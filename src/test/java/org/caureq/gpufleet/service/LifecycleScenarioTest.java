package org.caureq.gpufleet.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.caureq.gpufleet.bus.CommandHandler;
import org.caureq.gpufleet.bus.CommandMessage;
import org.caureq.gpufleet.bus.CommandPublisher;
import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.ActionLog;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.domain.VolumeKind;
import org.caureq.gpufleet.domain.VolumeStatus;
import org.caureq.gpufleet.repo.ActionLogRepo;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.repo.InstanceVolumeRepo;
import org.caureq.gpufleet.service.jobs.JobRunner;
import org.caureq.gpufleet.service.jobs.ProvisioningJob;
import org.caureq.gpufleet.service.jobs.TerminatorJob;
import org.caureq.gpufleet.service.lifecycle.InstanceTransitions;
import org.caureq.gpufleet.service.provider.CreateInstanceRequest;
import org.caureq.gpufleet.service.provider.MockCloudProvider;
import org.caureq.gpufleet.service.provider.ProviderException;
import org.caureq.gpufleet.service.provider.ProviderRegistry;
import org.caureq.gpufleet.support.MutableClock;
import org.caureq.gpufleet.support.TestBeans;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

/**
 * Whole lifecycles against the in-memory provider and an H2 ledger, driving
 * the services the job loops call.
 */
@DataJpaTest
@Import({TestBeans.class, MockCloudProvider.class, ProviderRegistry.class, ActionLogService.class,
        InstanceTransitions.class, WorkerTargets.class, ProviderSettingsService.class, BootstrapScriptRenderer.class,
        RetryBackoff.class, VolumeService.class, ProvisioningService.class, HealthCheckService.class,
        TerminationService.class, ReconciliationService.class, WorkerTokenService.class, HeartbeatService.class})
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_EACH_TEST_METHOD)
class LifecycleScenarioTest {

    @Autowired private InstanceRepo repo;
    @Autowired private InstanceVolumeRepo volumeRepo;
    @Autowired private ActionLogRepo actionLogRepo;
    @Autowired private MutableClock clock;
    @Autowired private MockCloudProvider mock;
    @Autowired private InstanceTransitions transitions;
    @Autowired private ProvisioningService provisioning;
    @Autowired private HealthCheckService health;
    @Autowired private TerminationService termination;
    @Autowired private ReconciliationService reconciliation;
    @Autowired private HeartbeatService heartbeats;
    @Autowired private ProviderRegistry providers;
    @Autowired private ActionLogService actionLog;
    @Autowired private BootstrapScriptRenderer bootstrap;
    @Autowired private AppProps props;
    @Autowired private ObjectMapper mapper;

    @BeforeEach
    void resetClock() {
        clock.set(TestBeans.START);
    }

    private UUID create(String instanceType) {
        return repo.saveAndFlush(Instance.builder()
                .provider("mock")
                .zone("mock-zone-1")
                .instanceType(instanceType)
                .modelId("Qwen/Qwen2.5-7B-Instruct")
                .status(InstanceStatus.PROVISIONING)
                .createdAt(clock.instant())
                .build()).getId();
    }

    private Instance load(UUID id) {
        return repo.findById(id).orElseThrow();
    }

    private List<String> actions(UUID id) {
        return actionLogRepo.findByInstanceIdOrderByCreatedAtAsc(id).stream().map(ActionLog::getActionType).toList();
    }

    private static HeartbeatService.WorkerReport report(String status) {
        return new HeartbeatService.WorkerReport(status, "Qwen/Qwen2.5-7B-Instruct", 8080, 9000, 0, 0.1, null);
    }

    /** Provisions, registers the worker and reports ready; returns the worker token. */
    private String bringUp(UUID id) {
        assertTrue(provisioning.provision(id));
        var reg = heartbeats.register(id, report(null), null, load(id).getIpAddress());
        clock.advance(Duration.ofSeconds(20));
        heartbeats.heartbeat(id, report("ready"), reg.token());
        health.checkBooting(load(id));
        assertEquals(InstanceStatus.READY, load(id).getStatus());
        return reg.token();
    }

    @Test
    void provisionBootReadyAndTerminate() {
        var id = create("MOCK-GPU-S");

        assertTrue(provisioning.provision(id));
        var booting = load(id);
        assertEquals(InstanceStatus.BOOTING, booting.getStatus());
        assertNotNull(booting.getProviderInstanceId());
        assertEquals("10.0.0.5", booting.getIpAddress());
        assertNotNull(booting.getBootStartedAt());
        assertNotNull(mock.bootstrapOf(booting.getProviderInstanceId()));

        var volumes = volumeRepo.findByInstanceIdOrderByCreatedAtAsc(id);
        assertEquals(2, volumes.size());
        assertTrue(volumes.stream().anyMatch(v -> v.getVolumeType() == VolumeKind.BOOT));
        var data = volumes.stream().filter(v -> v.getVolumeType() == VolumeKind.DATA).findFirst().orElseThrow();
        assertTrue(data.isDeleteOnTerminate());

        var reg = heartbeats.register(id, report(null), null, "10.0.0.5");
        assertNotNull(reg.token());
        health.checkBooting(load(id));
        assertEquals(InstanceStatus.BOOTING, load(id).getStatus(), "worker still starting");

        clock.advance(Duration.ofSeconds(30));
        heartbeats.heartbeat(id, report("ready"), reg.token());
        health.checkBooting(load(id));
        var ready = load(id);
        assertEquals(InstanceStatus.READY, ready.getStatus());
        assertEquals(9000, ready.getWorkerInferencePort());
        assertNotNull(ready.getReadyAt());

        assertTrue(transitions.requestTermination(ready, "admin_request", null, null));
        assertFalse(transitions.requestTermination(load(id), "admin_request", null, null));

        assertTrue(termination.terminate(id));
        var gone = load(id);
        assertEquals(InstanceStatus.TERMINATED, gone.getStatus());
        assertNotNull(gone.getTerminatedAt());
        assertFalse(mock.volumeExists(data.getProviderVolumeId()));
        assertEquals(2, volumeRepo.countByInstanceIdAndStatus(id, VolumeStatus.DELETED));

        assertFalse(termination.terminate(id));
        assertEquals(2, actions(id).stream().filter("PROVIDER_DELETE_VOLUME"::equals).count());
        assertEquals(1, actions(id).stream().filter("TERMINATION_CONFIRMED"::equals).count());
        assertTrue(actions(id).containsAll(List.of("INSTANCE_BOOTING", "INSTANCE_READY",
                "INSTANCE_TERMINATION_REQUESTED", "PROVIDER_TERMINATE", "TERMINATION_CONFIRMED")));
    }

    @Test
    void silentWorkerHitsTheStartupDeadline() {
        var id = create("DEV1-S");
        assertTrue(provisioning.provision(id));

        clock.advance(Duration.ofSeconds(300));
        health.checkBooting(load(id));
        assertEquals(InstanceStatus.BOOTING, load(id).getStatus());

        clock.advance(Duration.ofSeconds(1));
        health.checkBooting(load(id));
        var failed = load(id);
        assertEquals(InstanceStatus.STARTUP_FAILED, failed.getStatus());
        assertEquals(HealthCheckService.STARTUP_TIMEOUT, failed.getErrorCode());
        assertNotNull(failed.getFailedAt());

        var ex = assertThrows(org.caureq.gpufleet.api.error.ApiException.class,
                () -> heartbeats.register(id, report(null), null, failed.getIpAddress()));
        assertEquals(org.caureq.gpufleet.api.error.ErrorCode.STALE_INSTANCE, ex.code());
    }

    @Test
    void vanishedServerIsMarkedDeletedByProvider() {
        var id = create("MOCK-GPU-S");
        bringUp(id);
        var serverId = load(id).getProviderInstanceId();

        mock.simulateProviderDeletion(serverId);
        reconciliation.watch(load(id));

        var inst = load(id);
        assertEquals(InstanceStatus.TERMINATED, inst.getStatus());
        assertTrue(inst.isDeletedByProvider());
        assertEquals(InstanceTransitions.PROVIDER_DELETED_REASON, inst.getDeletionReason());
        assertTrue(actions(id).contains("PROVIDER_DELETED_DETECTED"));
        assertFalse(actions(id).contains("PROVIDER_TERMINATE"));

        assertEquals(0, volumeRepo.countByInstanceIdAndStatus(id, VolumeStatus.ATTACHED));
        var volumes = volumeRepo.findByInstanceIdOrderByCreatedAtAsc(id);
        var boot = volumes.stream().filter(v -> v.getVolumeType() == VolumeKind.BOOT).findFirst().orElseThrow();
        var data = volumes.stream().filter(v -> v.getVolumeType() == VolumeKind.DATA).findFirst().orElseThrow();
        assertEquals(VolumeStatus.DELETED, boot.getStatus());
        assertNotNull(boot.getDeletedAt());
        assertEquals(VolumeStatus.ERROR, data.getStatus());
        assertEquals(VolumeService.PROVIDER_DELETED_MESSAGE, data.getErrorMessage());
        assertTrue(actions(id).contains("VOLUMES_CLOSED_PROVIDER_DELETED"));

        reconciliation.watch(load(id));
        assertEquals(1, actions(id).stream().filter("VOLUMES_CLOSED_PROVIDER_DELETED"::equals).count());
    }

    /** Wires the bus handler against the real ledger; submitted work runs on the calling thread. */
    private CommandHandler commandHandler() {
        var runner = mock(JobRunner.class);
        doAnswer(inv -> {
            inv.<Runnable>getArgument(1).run();
            return null;
        }).when(runner).submit(anyString(), any(Runnable.class));
        var terminatorJob = new TerminatorJob(repo, termination, runner, props, clock);
        var commands = new InstanceCommandService(repo, providers, transitions, actionLog, bootstrap,
                mock(CommandPublisher.class), mock(ProvisioningJob.class), terminatorJob,
                mock(CatalogSyncService.class), reconciliation, runner, clock);
        return new CommandHandler(repo, commands, mock(ProvisioningJob.class), terminatorJob,
                mock(CatalogSyncService.class), reconciliation, runner, clock);
    }

    private Map<String, Long> deletesPerVolume(UUID id) {
        return actionLogRepo.findByInstanceIdOrderByCreatedAtAsc(id).stream()
                .filter(a -> "PROVIDER_DELETE_VOLUME".equals(a.getActionType()))
                .map(a -> {
                    try {
                        return mapper.readTree(a.getMetadata()).path("volume_id").asText();
                    } catch (Exception ex) {
                        throw new IllegalStateException(ex);
                    }
                })
                .collect(Collectors.groupingBy(v -> v, Collectors.counting()));
    }

    @Test
    void duplicateTerminateCommandsDeleteEachVolumeOnce() {
        var id = create("MOCK-GPU-S");
        bringUp(id);
        var handler = commandHandler();

        handler.handle(CommandMessage.terminate(id, "user_request", "c-1"));
        handler.handle(CommandMessage.terminate(id, "user_request", "c-2"));
        assertFalse(termination.terminate(id));
        assertFalse(termination.terminate(id));

        assertEquals(InstanceStatus.TERMINATED, load(id).getStatus());
        assertEquals(1, actions(id).stream().filter("TERMINATION_CONFIRMED"::equals).count());
        assertEquals(1, actions(id).stream().filter("INSTANCE_TERMINATION_REQUESTED"::equals).count());
        var deletes = deletesPerVolume(id);
        assertFalse(deletes.isEmpty());
        deletes.forEach((volume, count) -> assertEquals(1L, count, "deletes of " + volume));
        assertTrue(mock.listInstances("mock-zone-1").isEmpty());
    }

    @Test
    void outOfStockFailsProvisioningImmediately() {
        var id = create("MOCK-OOS");

        assertFalse(provisioning.provision(id));

        var inst = load(id);
        assertEquals(InstanceStatus.PROVISIONING_FAILED, inst.getStatus());
        assertEquals(ProviderException.OUT_OF_STOCK, inst.getErrorCode());
        assertNull(inst.getProviderInstanceId());
    }

    @Test
    void failedInstanceCanStillBeCleanedUp() {
        var id = create("DEV1-S");
        provisioning.provision(id);
        clock.advance(Duration.ofSeconds(400));
        health.checkBooting(load(id));
        assertEquals(InstanceStatus.STARTUP_FAILED, load(id).getStatus());

        assertTrue(transitions.requestTermination(load(id), "cleanup", null, null));
        assertTrue(termination.terminate(id));

        assertEquals(InstanceStatus.TERMINATED, load(id).getStatus());
    }

    @Test
    void staleHeartbeatRaisesOneAlertAndRecovers() {
        var id = create("MOCK-GPU-S");
        var token = bringUp(id);

        clock.advance(Duration.ofSeconds(90));
        health.checkReady(load(id));
        health.checkReady(load(id));
        heartbeats.heartbeat(id, report("ready"), token);
        health.checkReady(load(id));

        var log = actions(id);
        assertEquals(1, log.stream().filter("WORKER_HEARTBEAT_STALE"::equals).count());
        assertEquals(1, log.stream().filter("WORKER_HEARTBEAT_RECOVERED"::equals).count());
        assertEquals(InstanceStatus.READY, load(id).getStatus());
    }

    @Test
    void fullReconciliationReportsUnknownServers() {
        mock.createInstance(new CreateInstanceRequest("mock-zone-1", "MOCK-GPU-S", null, "hand-made"));
        var id = create("MOCK-GPU-S");
        provisioning.provision(id);

        var report = reconciliation.fullReconcile();

        assertEquals(2, report.remoteSeen());
        assertEquals(1, report.orphans());
        assertEquals(0, report.providerDeleted());
        assertEquals(1, actionLogRepo.findAll().stream()
                .filter(a -> "ORPHAN_REMOTE_DETECTED".equals(a.getActionType())).count());
    }

    @Test
    void actionLogEntriesAreCompletedWithMetadata() {
        var id = create("MOCK-GPU-S");
        provisioning.provision(id);

        var create = actionLogRepo.findByInstanceIdAndActionType(id, "PROVIDER_CREATE");
        assertEquals(1, create.size());
        assertNotNull(create.get(0).getCompletedAt());
        assertTrue(create.get(0).getMetadata().contains("mock-zone-1"));
    }
}
