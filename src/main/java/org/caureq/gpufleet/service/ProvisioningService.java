package org.caureq.gpufleet.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.domain.InstanceVolume;
import org.caureq.gpufleet.domain.VolumeKind;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.service.lifecycle.InstanceTransitions;
import org.caureq.gpufleet.service.provider.CloudProvider;
import org.caureq.gpufleet.service.provider.CreateInstanceRequest;
import org.caureq.gpufleet.service.provider.ProviderException;
import org.caureq.gpufleet.service.provider.ProviderRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one {@code provisioning} instance up to {@code booting}. Every step
 * is skipped when the ledger shows it already done, so a retried run picks up
 * where the previous one stopped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProvisioningService {
    public static final String MISSING_ZONE = "MISSING_ZONE";
    public static final String RETRIES_EXHAUSTED = "RETRIES_EXHAUSTED";
    private static final long GIB = 1024L * 1024 * 1024;

    private final InstanceRepo repo;
    private final ProviderRegistry providers;
    private final InstanceTransitions transitions;
    private final ActionLogService actionLog;
    private final VolumeService volumes;
    private final ProviderSettingsService settings;
    private final BootstrapScriptRenderer bootstrap;
    private final RetryBackoff backoff;
    private final AppProps props;
    private final Clock clock;

    public boolean provision(UUID instanceId) {
        return repo.findById(instanceId).map(this::provision).orElse(false);
    }

    /** @return true when the instance reached booting in this run */
    public boolean provision(Instance inst) {
        if (inst.getStatus() != InstanceStatus.PROVISIONING) {
            log.debug("instance {}: not provisioning ({}), skipped", inst.getId(), inst.getStatus());
            return false;
        }
        if (inst.getZone() == null || inst.getZone().isBlank()) {
            transitions.toProvisioningFailed(inst, MISSING_ZONE, "Instance has no zone");
            return false;
        }
        try {
            var provider = providers.get(inst.getProvider());
            if (!ensureServer(inst, provider)) return false;
            ensureDataVolume(inst, provider);
            volumes.importAttached(inst, provider, true);

            actionLog.tracedRun("PROVIDER_START", inst, meta(inst),
                    () -> provider.startInstance(inst.getZone(), inst.getProviderInstanceId()));

            resolveIp(inst, provider).ifPresent(ip -> {
                if (!ip.equals(inst.getIpAddress())) {
                    repo.recordIpAddress(inst.getId(), InstanceStatus.PROVISIONING, ip);
                    inst.setIpAddress(ip);
                }
            });

            var script = bootstrap.render(inst);
            actionLog.tracedRun("PROVIDER_BOOTSTRAP", inst, meta(inst),
                    () -> provider.pushBootstrap(inst.getZone(), inst.getProviderInstanceId(), script));

            return transitions.toBooting(inst);
        } catch (ProviderException ex) {
            onFailure(inst, ex);
            return false;
        }
    }

    private boolean ensureServer(Instance inst, CloudProvider provider) {
        if (inst.getProviderInstanceId() != null) return true;
        var request = new CreateInstanceRequest(inst.getZone(), inst.getInstanceType(), inst.getImageId(),
                serverName(inst));
        var serverId = actionLog.traced("PROVIDER_CREATE", inst, meta(inst), () -> provider.createInstance(request));
        if (repo.recordProviderInstanceId(inst.getId(), InstanceStatus.PROVISIONING, serverId) == 0) {
            releaseUnrecordedServer(inst, provider, serverId);
            return false;
        }
        inst.setProviderInstanceId(serverId);
        log.info("instance {}: server {} created in {}", inst.getId(), serverId, inst.getZone());
        return true;
    }

    /**
     * The row moved on while the server was being created, so nothing else
     * will ever delete it. A server the row already points at is left alone.
     */
    private void releaseUnrecordedServer(Instance inst, CloudProvider provider, String serverId) {
        var recorded = repo.findById(inst.getId()).map(Instance::getProviderInstanceId).orElse(null);
        if (serverId.equals(recorded)) {
            log.info("instance {}: server {} already recorded by another run", inst.getId(), serverId);
            return;
        }
        log.warn("instance {}: status moved during create, deleting unrecorded server {}", inst.getId(), serverId);
        var metadata = meta(inst);
        metadata.put("provider_instance_id", serverId);
        metadata.put("reason", "create_race");
        actionLog.tracedRun("PROVIDER_TERMINATE", inst, metadata,
                () -> provider.terminateInstance(inst.getZone(), serverId));
    }

    private void ensureDataVolume(Instance inst, CloudProvider provider) {
        var volumeId = volumes.liveDataVolume(inst)
                .map(InstanceVolume::getProviderVolumeId)
                .orElseGet(() -> createDataVolume(inst, provider));
        var attachMeta = meta(inst);
        attachMeta.put("volume_id", volumeId);
        actionLog.tracedRun("PROVIDER_ATTACH_VOLUME", inst, attachMeta,
                () -> provider.attachVolume(inst.getZone(), inst.getProviderInstanceId(), volumeId));
    }

    private String createDataVolume(Instance inst, CloudProvider provider) {
        int gb = inst.getDataVolumeGb() != null && inst.getDataVolumeGb() > 0
                ? inst.getDataVolumeGb() : settings.defaultVolumeGb(inst.getProvider());
        var name = serverName(inst) + "-data";
        var metadata = meta(inst);
        metadata.put("size_gb", gb);
        var volumeId = actionLog.traced("PROVIDER_CREATE_VOLUME", inst, metadata,
                () -> provider.createVolume(inst.getZone(), name, gb * GIB));
        volumes.recordCreated(inst, volumeId, name, gb * GIB, VolumeKind.DATA);
        return volumeId;
    }

    private Optional<String> resolveIp(Instance inst, CloudProvider provider) {
        var worker = props.worker();
        return actionLog.traced("PROVIDER_GET_IP", inst, meta(inst), () -> {
            for (int attempt = 1; attempt <= worker.ipAttempts(); attempt++) {
                var ip = provider.getInstanceIp(inst.getZone(), inst.getProviderInstanceId());
                if (ip.isPresent()) return ip;
                if (attempt < worker.ipAttempts() && !pause(worker.ipRetryDelay().toMillis())) break;
            }
            log.info("instance {}: no IP yet, health check will keep asking", inst.getId());
            return Optional.<String>empty();
        });
    }

    private void onFailure(Instance inst, ProviderException ex) {
        if (!ex.retryable()) {
            log.warn("instance {}: provisioning failed permanently: {} {}", inst.getId(), ex.code(), ex.getMessage());
            transitions.toProvisioningFailed(inst, ex.code(), ex.getMessage());
            return;
        }
        int attempt = inst.getRetryCount() + 1;
        if (backoff.exhausted(attempt)) {
            log.warn("instance {}: giving up after {} attempts: {}", inst.getId(), attempt, ex.getMessage());
            transitions.toProvisioningFailed(inst, RETRIES_EXHAUSTED,
                    "Retries exhausted after " + attempt + " attempts, last error " + ex.code() + ": " + ex.getMessage());
            return;
        }
        var delay = backoff.delayFor(attempt);
        int n = repo.recordTransientFailure(inst.getId(), InstanceStatus.PROVISIONING, ex.code(), ex.getMessage(),
                clock.instant().plus(delay));
        if (n > 0) {
            log.warn("instance {}: transient {} (attempt {}), next try in {}", inst.getId(), ex.code(), attempt, delay);
        }
    }

    private static boolean pause(long millis) {
        if (millis <= 0) return true;
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static String serverName(Instance inst) {
        return "gpu-" + inst.getId();
    }

    private static Map<String, Object> meta(Instance inst) {
        var m = new HashMap<String, Object>();
        m.put("zone", inst.getZone());
        m.put("instance_type", inst.getInstanceType());
        if (inst.getProviderInstanceId() != null) m.put("provider_instance_id", inst.getProviderInstanceId());
        return m;
    }
}
