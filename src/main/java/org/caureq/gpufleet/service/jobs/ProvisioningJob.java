package org.caureq.gpufleet.service.jobs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.ProvisioningService;
import org.caureq.gpufleet.service.RetryBackoff;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class ProvisioningJob {
    static final String NAME = "provisioning";

    private final InstanceRepo repo;
    private final ProvisioningService provisioning;
    private final RetryBackoff backoff;
    private final JobRunner runner;
    private final AppProps props;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.jobs.provisioning.interval-ms:10000}",
            initialDelayString = "${app.jobs.initial-delay-ms:5000}")
    public void tick() {
        runner.runAll(NAME, claimBatch(), provisioning::provision);
    }

    List<Instance> claimBatch() {
        var cfg = props.jobs().provisioning();
        var now = clock.instant();
        var candidates = repo.findProvisioningCandidates(InstanceStatus.PROVISIONING, now,
                now.minus(cfg.grace()), now.minus(cfg.lease()), backoff.maxRetries(),
                PageRequest.of(0, cfg.batchSize()));
        return candidates.stream()
                .filter(i -> repo.claimReconciliationLease(i.getId(), now, now.minus(cfg.lease())) > 0)
                .toList();
    }

    /** Bus fast path; skipped when a tick already holds the lease. */
    public void runNow(UUID instanceId) {
        var now = clock.instant();
        if (repo.claimReconciliationLease(instanceId, now, now.minus(props.jobs().provisioning().lease())) == 0) {
            log.debug("instance {}: provisioning already in progress", instanceId);
            return;
        }
        runner.submit(NAME + ":" + instanceId, () -> provisioning.provision(instanceId));
    }
}
