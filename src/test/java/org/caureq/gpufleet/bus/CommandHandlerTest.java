package org.caureq.gpufleet.bus;

import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.CatalogSyncService;
import org.caureq.gpufleet.service.InstanceCommandService;
import org.caureq.gpufleet.service.ReconciliationService;
import org.caureq.gpufleet.service.jobs.JobRunner;
import org.caureq.gpufleet.service.jobs.ProvisioningJob;
import org.caureq.gpufleet.service.jobs.TerminatorJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommandHandlerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock private InstanceRepo repo;
    @Mock private InstanceCommandService commands;
    @Mock private ProvisioningJob provisioningJob;
    @Mock private TerminatorJob terminatorJob;
    @Mock private CatalogSyncService catalog;
    @Mock private ReconciliationService reconciliation;
    @Mock private JobRunner runner;

    private CommandHandler handler;
    private final UUID id = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        handler = new CommandHandler(repo, commands, provisioningJob, terminatorJob, catalog, reconciliation, runner,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private CommandMessage message(CommandType type, String zone, String instanceType, String provider) {
        return new CommandMessage(type.wire(), id, zone, instanceType, provider, null, null, "cid");
    }

    @Nested
    @DisplayName("provision")
    class Provision {

        @Test
        void unknownInstanceIsCreatedThenProvisioned() {
            when(repo.existsById(id)).thenReturn(false);

            handler.handle(message(CommandType.PROVISION, "mock-zone-1", "MOCK-GPU-S", null));

            var captor = ArgumentCaptor.forClass(Instance.class);
            verify(repo).save(captor.capture());
            assertEquals(id, captor.getValue().getId());
            assertEquals("mock", captor.getValue().getProvider());
            assertEquals(InstanceStatus.PROVISIONING, captor.getValue().getStatus());
            assertEquals(NOW, captor.getValue().getCreatedAt());
            verify(provisioningJob).runNow(id);
        }

        @Test
        void knownInstanceIsOnlyProvisioned() {
            when(repo.existsById(id)).thenReturn(true);

            handler.handle(message(CommandType.PROVISION, null, null, null));

            verify(repo, never()).save(any());
            verify(provisioningJob).runNow(id);
        }

        @Test
        void unknownInstanceWithoutPlacementIsDropped() {
            when(repo.existsById(id)).thenReturn(false);

            handler.handle(message(CommandType.PROVISION, null, "MOCK-GPU-S", null));

            verify(repo, never()).save(any());
            verifyNoInteractions(provisioningJob);
        }
    }

    @Nested
    @DisplayName("terminate")
    class Terminate {

        @Test
        void marksTerminatingThenRunsTheTerminator() {
            var inst = Instance.builder().id(id).status(InstanceStatus.READY).build();
            when(repo.findById(id)).thenReturn(Optional.of(inst));
            when(commands.markTerminating(inst, CommandHandler.DEFAULT_TERMINATE_REASON)).thenReturn(true);

            handler.handle(message(CommandType.TERMINATE, null, null, null));

            verify(terminatorJob).runNow(id);
        }

        @Test
        void refusedTransitionDoesNotRunTheTerminator() {
            var inst = Instance.builder().id(id).status(InstanceStatus.ARCHIVED).build();
            when(repo.findById(id)).thenReturn(Optional.of(inst));
            when(commands.markTerminating(inst, CommandHandler.DEFAULT_TERMINATE_REASON)).thenReturn(false);

            handler.handle(message(CommandType.TERMINATE, null, null, null));

            verifyNoInteractions(terminatorJob);
        }

        @Test
        void unknownInstanceIsDropped() {
            when(repo.findById(id)).thenReturn(Optional.empty());

            handler.handle(message(CommandType.TERMINATE, null, null, null));

            verifyNoInteractions(commands, terminatorJob);
        }
    }

    @Test
    void catalogSyncAndReconcileRunInThePool() {
        handler.handle(CommandMessage.of(CommandType.SYNC_CATALOG, "cid"));
        handler.handle(CommandMessage.of(CommandType.RECONCILE, "cid"));

        var captor = ArgumentCaptor.forClass(Runnable.class);
        verify(runner).submit(eq("catalog-sync"), captor.capture());
        captor.getValue().run();
        verify(catalog).syncAll();
        verify(runner).submit(eq("reconcile"), any());
    }

    @Test
    void reinstallIsDelegated() {
        handler.handle(message(CommandType.REINSTALL, null, null, null));

        var captor = ArgumentCaptor.forClass(Runnable.class);
        verify(runner).submit(startsWith("reinstall:"), captor.capture());
        captor.getValue().run();
        verify(commands).reinstall(id);
    }

    @Test
    void unknownTypeIsIgnored() {
        handler.handle(new CommandMessage("CMD:REBOOT", id, null, null, null, null, null, null));

        verifyNoInteractions(repo, commands, runner, provisioningJob, terminatorJob);
    }
}
