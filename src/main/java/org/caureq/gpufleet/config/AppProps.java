package org.caureq.gpufleet.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** Everything under {@code app.*}; absent keys fall back to the defaults below. */
@ConfigurationProperties(prefix = "app")
public record AppProps(AdminProps admin, JobsProps jobs, RetryProps retry, WorkerProps worker, BusProps bus) {

    public AppProps {
        if (admin == null) admin = new AdminProps(null, null);
        if (jobs == null) jobs = new JobsProps(0, null, false, null, null, null, null);
        if (retry == null) retry = new RetryProps(0, null, null, 0);
        if (worker == null) worker = new WorkerProps(null, null, null, null, null, 0, null, 0, 0, 0, null);
        if (bus == null) bus = new BusProps(null, null);
    }

    /** Admin API key and client allowlist (exact IPv4, CIDR or *) */
    public record AdminProps(String apiKey, String allowIps) {}

    /** Shared job-loop tunables; per-loop batch size and lease below */
    public record JobsProps(int concurrency, Duration tickTimeout, boolean syncCatalogOnStartup,
                            JobProps provisioning, JobProps health, JobProps terminator, JobProps watchdog) {
        public JobsProps {
            if (concurrency <= 0) concurrency = 8;
            if (tickTimeout == null) tickTimeout = Duration.ofSeconds(120);
            provisioning = JobProps.orDefault(provisioning, 25, Duration.ofSeconds(30), Duration.ofSeconds(30));
            health = JobProps.orDefault(health, 50, Duration.ofSeconds(10), Duration.ZERO);
            terminator = JobProps.orDefault(terminator, 50, Duration.ofSeconds(30), Duration.ZERO);
            watchdog = JobProps.orDefault(watchdog, 50, Duration.ofSeconds(60), Duration.ZERO);
        }
    }

    /**
     * @param batchSize max rows claimed per tick
     * @param lease     a row is skipped if another tick touched it more recently than this
     * @param grace     minimum row age before the loop picks it up (provisioning only)
     */
    public record JobProps(int batchSize, Duration lease, Duration grace) {
        static JobProps orDefault(JobProps p, int batchSize, Duration lease, Duration grace) {
            if (p == null) return new JobProps(batchSize, lease, grace);
            return new JobProps(p.batchSize() > 0 ? p.batchSize() : batchSize,
                    p.lease() != null ? p.lease() : lease,
                    p.grace() != null ? p.grace() : grace);
        }
    }

    /** Bounded exponential backoff for transient provisioning failures */
    public record RetryProps(int maxRetries, Duration initialBackoff, Duration maxBackoff, double multiplier) {
        public RetryProps {
            if (maxRetries <= 0) maxRetries = 5;
            if (initialBackoff == null) initialBackoff = Duration.ofSeconds(30);
            if (maxBackoff == null) maxBackoff = Duration.ofMinutes(10);
            if (multiplier < 1.0) multiplier = 2.0;
        }
    }

    /**
     * Worker host settings. The startup timeouts stay null when unset so the
     * per-provider database setting and the built-in default can take over.
     */
    public record WorkerProps(Duration heartbeatStaleness,
                              Duration startupTimeout,
                              Duration workerStartupTimeout,
                              String targetPatterns,
                              Duration ipMissingRetryAfter,
                              int ipAttempts,
                              Duration ipRetryDelay,
                              int healthPort,
                              int inferencePort,
                              int defaultVolumeGb,
                              String controlPlaneUrl) {
        public WorkerProps {
            if (heartbeatStaleness == null) heartbeatStaleness = Duration.ofSeconds(60);
            if (ipMissingRetryAfter == null) ipMissingRetryAfter = Duration.ofSeconds(300);
            if (ipAttempts <= 0) ipAttempts = 5;
            if (ipRetryDelay == null) ipRetryDelay = Duration.ofSeconds(2);
            if (controlPlaneUrl == null || controlPlaneUrl.isBlank()) controlPlaneUrl = "http://127.0.0.1:8080";
        }
    }

    /** Fanout exchange carrying orchestrator commands */
    public record BusProps(String channel, Boolean enabled) {
        public BusProps {
            if (channel == null || channel.isBlank()) channel = "orchestrator_events";
            if (enabled == null) enabled = Boolean.TRUE;
        }
    }
}
