package org.caureq.gpufleet.service.jobs;

import lombok.RequiredArgsConstructor;
import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.HealthCheckService;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
@RequiredArgsConstructor
public class HealthCheckJob {
    static final String NAME = "health-check";

    private final InstanceRepo repo;
    private final HealthCheckService health;
    private final JobRunner runner;
    private final AppProps props;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.jobs.health.interval-ms:10000}",
            initialDelayString = "${app.jobs.initial-delay-ms:5000}")
    public void tick() {
        runner.runAll(NAME, claimBatch(InstanceStatus.BOOTING), health::checkBooting);
        runner.runAll(NAME, claimBatch(InstanceStatus.READY), health::checkReady);
    }

    List<Instance> claimBatch(InstanceStatus status) {
        var cfg = props.jobs().health();
        var now = clock.instant();
        var cutoff = now.minus(cfg.lease());
        return repo.findHealthCandidates(status, cutoff, PageRequest.of(0, cfg.batchSize())).stream()
                .filter(i -> repo.claimHealthCheckLease(i.getId(), now, cutoff) > 0)
                .toList();
    }
}
