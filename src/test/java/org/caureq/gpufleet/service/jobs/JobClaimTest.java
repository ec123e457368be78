package org.caureq.gpufleet.service.jobs;

import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.HealthCheckService;
import org.caureq.gpufleet.service.ProvisioningService;
import org.caureq.gpufleet.service.ReconciliationService;
import org.caureq.gpufleet.service.RetryBackoff;
import org.caureq.gpufleet.service.TerminationService;
import org.caureq.gpufleet.support.MutableClock;
import org.caureq.gpufleet.support.TestBeans;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/** Candidate selection and lease claiming of the job loops against a real ledger. */
@DataJpaTest
@Import(TestBeans.class)
class JobClaimTest {

    @Autowired private InstanceRepo repo;
    @Autowired private AppProps props;
    @Autowired private MutableClock clock;

    private final JobRunner runner = mock(JobRunner.class);

    @BeforeEach
    void resetClock() {
        clock.set(TestBeans.START);
    }

    private UUID insert(InstanceStatus status, Duration age) {
        return repo.saveAndFlush(Instance.builder()
                .provider("mock")
                .zone("mock-zone-1")
                .instanceType("MOCK-GPU-S")
                .providerInstanceId(status == InstanceStatus.PROVISIONING ? null : "mock-" + UUID.randomUUID())
                .status(status)
                .createdAt(clock.instant().minus(age))
                .build()).getId();
    }

    private static Set<UUID> ids(java.util.List<Instance> batch) {
        return batch.stream().map(Instance::getId).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("provisioning")
    class Provisioning {

        private ProvisioningJob job;

        @BeforeEach
        void setUp() {
            job = new ProvisioningJob(repo, mock(ProvisioningService.class), new RetryBackoff(props), runner, props, clock);
        }

        @Test
        void claimsEachDueRowOncePerLease() {
            var a = insert(InstanceStatus.PROVISIONING, Duration.ofMinutes(2));
            var b = insert(InstanceStatus.PROVISIONING, Duration.ofMinutes(1));
            insert(InstanceStatus.PROVISIONING, Duration.ofSeconds(5));
            insert(InstanceStatus.BOOTING, Duration.ofMinutes(5));

            assertEquals(Set.of(a, b), ids(job.claimBatch()));
            assertTrue(job.claimBatch().isEmpty());

            clock.advance(Duration.ofSeconds(31));
            assertEquals(3, job.claimBatch().size());
        }

        @Test
        void fastPathStandsBackWhileATickHoldsTheLease() {
            var a = insert(InstanceStatus.PROVISIONING, Duration.ofMinutes(2));
            job.claimBatch();

            job.runNow(a);

            verify(runner, never()).submit(anyString(), any(Runnable.class));
        }

        @Test
        void fastPathRunsAFreshRowImmediately() {
            var a = insert(InstanceStatus.PROVISIONING, Duration.ZERO);

            job.runNow(a);

            verify(runner).submit(anyString(), any(Runnable.class));
        }
    }

    @Nested
    @DisplayName("health check")
    class Health {

        @Test
        void bootingAndReadyAreClaimedSeparately() {
            var job = new HealthCheckJob(repo, mock(HealthCheckService.class), runner, props, clock);
            var booting = insert(InstanceStatus.BOOTING, Duration.ofMinutes(1));
            var ready = insert(InstanceStatus.READY, Duration.ofMinutes(1));

            assertEquals(Set.of(booting), ids(job.claimBatch(InstanceStatus.BOOTING)));
            assertEquals(Set.of(ready), ids(job.claimBatch(InstanceStatus.READY)));
            assertTrue(job.claimBatch(InstanceStatus.BOOTING).isEmpty());

            clock.advance(props.jobs().health().lease().plusSeconds(1));
            assertEquals(Set.of(booting), ids(job.claimBatch(InstanceStatus.BOOTING)));
        }
    }

    @Nested
    @DisplayName("terminator and watch-dog")
    class Leases {

        @Test
        void terminatorOnlySeesTerminatingRows() {
            var job = new TerminatorJob(repo, mock(TerminationService.class), runner, props, clock);
            var t = insert(InstanceStatus.TERMINATING, Duration.ofMinutes(1));
            insert(InstanceStatus.READY, Duration.ofMinutes(1));
            insert(InstanceStatus.TERMINATED, Duration.ofMinutes(1));

            assertEquals(Set.of(t), ids(job.claimBatch()));
        }

        @Test
        void watchDogSeesActiveRowsAndSharesTheLeaseColumn() {
            var watchDog = new WatchDogJob(repo, mock(ReconciliationService.class), runner, props, clock);
            var booting = insert(InstanceStatus.BOOTING, Duration.ofMinutes(1));
            var ready = insert(InstanceStatus.READY, Duration.ofMinutes(1));
            var draining = insert(InstanceStatus.DRAINING, Duration.ofMinutes(1));
            insert(InstanceStatus.TERMINATING, Duration.ofMinutes(1));
            insert(InstanceStatus.STARTUP_FAILED, Duration.ofMinutes(1));

            assertEquals(Set.of(booting, ready, draining), ids(watchDog.claimBatch()));
            assertTrue(watchDog.claimBatch().isEmpty());

            clock.advance(props.jobs().watchdog().lease().plusSeconds(1));
            assertEquals(3, watchDog.claimBatch().size());
        }
    }
}
