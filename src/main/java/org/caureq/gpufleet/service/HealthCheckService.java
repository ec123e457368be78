package org.caureq.gpufleet.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.ActionStatus;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.lifecycle.InstanceTransitions;
import org.caureq.gpufleet.service.provider.ProviderException;
import org.caureq.gpufleet.service.provider.ProviderRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;

/**
 * Booting instances: readiness from worker heartbeats, missing IP recovery and
 * the startup deadline. Ready instances: stale heartbeat alerts only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthCheckService {
    public static final String STARTUP_TIMEOUT = "STARTUP_TIMEOUT";
    public static final String PROVIDER_OUT_OF_STOCK = "PROVIDER_OUT_OF_STOCK";
    public static final String OUT_OF_STOCK_REASON = "provider_out_of_stock";

    private final InstanceRepo repo;
    private final ProviderRegistry providers;
    private final InstanceTransitions transitions;
    private final ActionLogService actionLog;
    private final ProviderSettingsService settings;
    private final AppProps props;
    private final Clock clock;

    public void checkBooting(Instance inst) {
        if (inst.getStatus() != InstanceStatus.BOOTING) return;
        var now = clock.instant();

        if (heartbeatFresh(inst, now) && "ready".equalsIgnoreCase(inst.getWorkerStatus())) {
            transitions.toReady(inst);
            return;
        }

        if (inst.getIpAddress() == null && inst.getProviderInstanceId() != null && inst.getZone() != null) {
            try {
                recoverIp(inst, now);
            } catch (ProviderException ex) {
                if (ex.isOutOfStock()) {
                    transitions.requestTermination(inst, OUT_OF_STOCK_REASON, PROVIDER_OUT_OF_STOCK, ex.getMessage());
                    return;
                }
                log.warn("instance {}: IP lookup failed: {} {}", inst.getId(), ex.code(), ex.getMessage());
            }
        }

        var timeout = settings.startupTimeout(inst);
        var started = inst.getBootStartedAt() != null ? inst.getBootStartedAt() : inst.getCreatedAt();
        if (started != null && Duration.between(started, now).compareTo(timeout) > 0) {
            transitions.toStartupFailed(inst, STARTUP_TIMEOUT,
                    "Worker not ready " + timeout.toSeconds() + "s after boot start");
            return;
        }
        repo.incrementHealthCheckFailures(inst.getId(), InstanceStatus.BOOTING);
    }

    /** Emits one stale alert per episode and one recovery; never moves the status. */
    public void checkReady(Instance inst) {
        if (inst.getStatus() != InstanceStatus.READY) return;
        var now = clock.instant();
        if (heartbeatFresh(inst, now)) {
            if (inst.getHealthCheckFailures() > 0 && repo.resetHealthCheckFailures(inst.getId()) > 0) {
                actionLog.record("WORKER_HEARTBEAT_RECOVERED", inst.getId(), inst.getStatus(), inst.getStatus(),
                        ActionStatus.SUCCESS, null, null, heartbeatMeta(inst, now));
                log.info("instance {}: worker heartbeat recovered", inst.getId());
            }
            return;
        }
        if (repo.openStaleEpisode(inst.getId(), InstanceStatus.READY) > 0) {
            actionLog.record("WORKER_HEARTBEAT_STALE", inst.getId(), inst.getStatus(), inst.getStatus(),
                    ActionStatus.FAILED, "WORKER_HEARTBEAT_STALE", "No heartbeat within "
                            + props.worker().heartbeatStaleness().toSeconds() + "s", heartbeatMeta(inst, now));
            log.warn("instance {}: worker heartbeat stale (last {})", inst.getId(), inst.getWorkerLastHeartbeat());
        } else {
            repo.incrementHealthCheckFailures(inst.getId(), InstanceStatus.READY);
        }
    }

    boolean heartbeatFresh(Instance inst, Instant now) {
        var hb = inst.getWorkerLastHeartbeat();
        return hb != null && Duration.between(hb, now).compareTo(props.worker().heartbeatStaleness()) < 0;
    }

    private void recoverIp(Instance inst, Instant now) {
        var provider = providers.get(inst.getProvider());
        var ip = provider.getInstanceIp(inst.getZone(), inst.getProviderInstanceId());
        if (ip.isPresent()) {
            if (repo.recordIpAddress(inst.getId(), InstanceStatus.BOOTING, ip.get()) > 0) {
                inst.setIpAddress(ip.get());
                log.info("instance {}: got IP {}", inst.getId(), ip.get());
            }
            return;
        }
        var since = inst.getBootStartedAt() != null ? inst.getBootStartedAt() : inst.getCreatedAt();
        if (since != null && Duration.between(since, now).compareTo(props.worker().ipMissingRetryAfter()) > 0) {
            var meta = new HashMap<String, Object>();
            meta.put("provider_instance_id", inst.getProviderInstanceId());
            meta.put("reason", "ip_missing");
            actionLog.tracedRun("PROVIDER_START", inst, meta,
                    () -> provider.startInstance(inst.getZone(), inst.getProviderInstanceId()));
        }
    }

    private static HashMap<String, Object> heartbeatMeta(Instance inst, Instant now) {
        var m = new HashMap<String, Object>();
        if (inst.getWorkerLastHeartbeat() != null) {
            m.put("last_heartbeat", inst.getWorkerLastHeartbeat().toString());
            m.put("age_s", Duration.between(inst.getWorkerLastHeartbeat(), now).toSeconds());
        }
        m.put("worker_status", inst.getWorkerStatus());
        return m;
    }
}
