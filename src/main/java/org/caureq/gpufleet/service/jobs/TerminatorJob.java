package org.caureq.gpufleet.service.jobs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.TerminationService;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class TerminatorJob {
    static final String NAME = "terminator";

    private final InstanceRepo repo;
    private final TerminationService termination;
    private final JobRunner runner;
    private final AppProps props;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.jobs.terminator.interval-ms:10000}",
            initialDelayString = "${app.jobs.initial-delay-ms:5000}")
    public void tick() {
        runner.runAll(NAME, claimBatch(), termination::terminate);
    }

    List<Instance> claimBatch() {
        var cfg = props.jobs().terminator();
        var now = clock.instant();
        var cutoff = now.minus(cfg.lease());
        return repo.findLeaseCandidates(List.of(InstanceStatus.TERMINATING), cutoff, PageRequest.of(0, cfg.batchSize()))
                .stream()
                .filter(i -> repo.claimReconciliationLease(i.getId(), now, cutoff) > 0)
                .toList();
    }

    public void runNow(UUID instanceId) {
        var now = clock.instant();
        if (repo.claimReconciliationLease(instanceId, now, now.minus(props.jobs().terminator().lease())) == 0) {
            log.debug("instance {}: termination already in progress", instanceId);
            return;
        }
        runner.submit(NAME + ":" + instanceId, () -> termination.terminate(instanceId));
    }
}
