package org.caureq.gpufleet.service.jobs;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.Instance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Bounded worker pool shared by the job loops and the command listener. One
 * instance failing never stops the others.
 */
@Component
@Slf4j
public class JobRunner {
    private final ExecutorService pool;
    private final Duration tickTimeout;

    @Autowired
    public JobRunner(AppProps props) {
        this(Executors.newFixedThreadPool(props.jobs().concurrency(), new CustomizableThreadFactory("fleet-job-")),
                props.jobs().tickTimeout());
    }

    public JobRunner(ExecutorService pool, Duration tickTimeout) {
        this.pool = pool;
        this.tickTimeout = tickTimeout;
    }

    /**
     * Runs {@code work} for every instance and waits for all of them, at most
     * the tick timeout. Work still running after that finishes in the background.
     */
    public void runAll(String job, Collection<Instance> instances, Consumer<Instance> work) {
        if (instances.isEmpty()) return;
        var futures = instances.stream()
                .map(inst -> CompletableFuture.runAsync(() -> isolated(job, inst, work), pool))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(tickTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[{}] tick exceeded {} with {} instance(s), continuing in background", job, tickTimeout, futures.length);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] interrupted while waiting for the tick", job);
        } catch (ExecutionException e) {
            log.error("[{}] tick failed", job, e.getCause());
        }
        log.debug("[{}] processed {} instance(s)", job, futures.length);
    }

    /** Fire-and-forget task, used for bus commands. */
    public void submit(String what, Runnable task) {
        pool.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                log.error("[{}] failed", what, ex);
            }
        });
    }

    private static void isolated(String job, Instance inst, Consumer<Instance> work) {
        try {
            work.accept(inst);
        } catch (RuntimeException ex) {
            log.error("[{}] instance {} failed: {}", job, inst.getId(), ex.getMessage(), ex);
        }
    }

    @PreDestroy
    void shutdown() throws InterruptedException {
        pool.shutdown();
        if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
            log.warn("job pool did not drain in 10s, interrupting");
            pool.shutdownNow();
        }
    }
}
