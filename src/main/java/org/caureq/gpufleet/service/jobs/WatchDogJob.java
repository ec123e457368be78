package org.caureq.gpufleet.service.jobs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.ReconciliationService;
import org.caureq.gpufleet.service.provider.ProviderException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Drift detection. Each tick checks a batch of active instances; a slower
 * loop lists every zone to catch servers the ledger does not know about.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WatchDogJob {
    static final String NAME = "watch-dog";

    private final InstanceRepo repo;
    private final ReconciliationService reconciliation;
    private final JobRunner runner;
    private final AppProps props;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.jobs.watchdog.interval-ms:10000}",
            initialDelayString = "${app.jobs.initial-delay-ms:5000}")
    public void tick() {
        runner.runAll(NAME, claimBatch(), reconciliation::watch);
    }

    @Scheduled(fixedDelayString = "${app.jobs.reconcile.interval-ms:300000}",
            initialDelayString = "${app.jobs.reconcile.initial-delay-ms:60000}")
    public void reconcileTick() {
        try {
            reconciliation.fullReconcile();
        } catch (ProviderException | DataAccessException ex) {
            log.warn("[Reconcile] periodic pass failed: {}", ex.getMessage());
        }
    }

    List<Instance> claimBatch() {
        var cfg = props.jobs().watchdog();
        var now = clock.instant();
        var cutoff = now.minus(cfg.lease());
        return repo.findLeaseCandidates(InstanceStatus.ACTIVE, cutoff, PageRequest.of(0, cfg.batchSize())).stream()
                .filter(i -> repo.claimReconciliationLease(i.getId(), now, cutoff) > 0)
                .toList();
    }
}
