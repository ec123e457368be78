package org.caureq.gpufleet.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.domain.InstanceVolume;
import org.caureq.gpufleet.domain.VolumeStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.repo.InstanceVolumeRepo;
import org.caureq.gpufleet.service.lifecycle.InstanceTransitions;
import org.caureq.gpufleet.service.provider.CloudProvider;
import org.caureq.gpufleet.service.provider.ProviderException;
import org.caureq.gpufleet.service.provider.ProviderRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives a {@code terminating} instance to {@code terminated}: the server is
 * deleted first, then the volumes we own, then the status is confirmed. Any
 * step that cannot finish leaves the row terminating for the next tick.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TerminationService {
    public static final String NO_PROVIDER_RESOURCE = "no_provider_resource";
    public static final String MISSING_ZONE = "MISSING_ZONE";
    public static final String VOLUMES_DELETE_PENDING = "VOLUMES_DELETE_PENDING";

    private static final List<VolumeStatus> UNRESOLVED =
            List.of(VolumeStatus.ATTACHED, VolumeStatus.DETACHING, VolumeStatus.ERROR);

    private final InstanceRepo repo;
    private final InstanceVolumeRepo volumeRepo;
    private final ProviderRegistry providers;
    private final InstanceTransitions transitions;
    private final ActionLogService actionLog;
    private final Clock clock;

    public boolean terminate(UUID instanceId) {
        return repo.findById(instanceId).map(this::terminate).orElse(false);
    }

    /** @return true when the instance reached terminated in this run */
    public boolean terminate(Instance inst) {
        if (inst.getStatus() != InstanceStatus.TERMINATING) return false;

        if (inst.getProviderInstanceId() == null) {
            if (repo.recordDeletionReason(inst.getId(), NO_PROVIDER_RESOURCE) > 0) {
                inst.setDeletionReason(NO_PROVIDER_RESOURCE);
            }
            var provider = providers.has(inst.getProvider()) ? providers.get(inst.getProvider()) : null;
            if (!resolveVolumes(inst, provider)) return false;
            return transitions.toTerminated(inst);
        }
        if (inst.getZone() == null || inst.getZone().isBlank()) {
            repo.recordError(inst.getId(), InstanceStatus.TERMINATING, MISSING_ZONE,
                    "Cannot terminate " + inst.getProviderInstanceId() + " without a zone");
            log.warn("instance {}: terminating without zone", inst.getId());
            return false;
        }

        try {
            var provider = providers.get(inst.getProvider());
            if (provider.instanceExists(inst.getZone(), inst.getProviderInstanceId())) {
                var actionType = actionLog.hasEntry(inst.getId(), "PROVIDER_TERMINATE")
                        ? "TERMINATOR_RETRY" : "PROVIDER_TERMINATE";
                actionLog.tracedRun(actionType, inst, meta(inst),
                        () -> provider.terminateInstance(inst.getZone(), inst.getProviderInstanceId()));
                if (provider.instanceExists(inst.getZone(), inst.getProviderInstanceId())) {
                    log.debug("instance {}: server {} still shutting down", inst.getId(), inst.getProviderInstanceId());
                    return false;
                }
            }
            if (!resolveVolumes(inst, provider)) return false;
            return transitions.toTerminated(inst);
        } catch (ProviderException ex) {
            repo.recordError(inst.getId(), InstanceStatus.TERMINATING, ex.code(), ex.getMessage());
            log.warn("instance {}: termination step failed: {} {}", inst.getId(), ex.code(), ex.getMessage());
            return false;
        }
    }

    /**
     * Deletes owned volumes and releases the others. A volume already gone at
     * the provider counts as deleted; a deleted row is never deleted again.
     *
     * @return true when no volume is left unresolved
     */
    boolean resolveVolumes(Instance inst, CloudProvider provider) {
        int pending = 0;
        for (var v : volumeRepo.findByInstanceIdAndStatusIn(inst.getId(), UNRESOLVED)) {
            if (!resolve(inst, provider, v)) pending++;
        }
        if (pending > 0) {
            repo.recordError(inst.getId(), InstanceStatus.TERMINATING, VOLUMES_DELETE_PENDING,
                    pending + " volume(s) not deleted yet");
            log.warn("instance {}: {} volume(s) pending deletion", inst.getId(), pending);
            return false;
        }
        return true;
    }

    private boolean resolve(Instance inst, CloudProvider provider, InstanceVolume v) {
        if (v.getProviderVolumeId() == null) {
            volumeRepo.markDeleted(v.getId(), VolumeStatus.DELETED, clock.instant());
            return true;
        }
        if (provider == null || inst.getZone() == null) return false;

        var meta = meta(inst);
        meta.put("volume_id", v.getProviderVolumeId());
        try {
            if (!v.isDeleteOnTerminate()) {
                if (inst.getProviderInstanceId() != null) {
                    actionLog.tracedRun("PROVIDER_DETACH_VOLUME", inst, meta, () -> provider.detachVolume(
                            inst.getZone(), inst.getProviderInstanceId(), v.getProviderVolumeId()));
                }
                volumeRepo.moveStatus(v.getId(), v.getStatus(), VolumeStatus.DETACHED, null);
                return true;
            }
            actionLog.tracedRun("PROVIDER_DELETE_VOLUME", inst, meta,
                    () -> provider.deleteVolume(inst.getZone(), v.getProviderVolumeId()));
            volumeRepo.markDeleted(v.getId(), VolumeStatus.DELETED, clock.instant());
            return true;
        } catch (ProviderException ex) {
            if (ex.isNotFound()) {
                volumeRepo.markDeleted(v.getId(), VolumeStatus.DELETED, clock.instant());
                return true;
            }
            volumeRepo.moveStatus(v.getId(), v.getStatus(), VolumeStatus.ERROR, ex.getMessage());
            log.warn("instance {}: volume {} not released: {}", inst.getId(), v.getProviderVolumeId(), ex.getMessage());
            return false;
        }
    }

    private static Map<String, Object> meta(Instance inst) {
        var m = new HashMap<String, Object>();
        m.put("zone", inst.getZone());
        if (inst.getProviderInstanceId() != null) m.put("provider_instance_id", inst.getProviderInstanceId());
        if (inst.getDeletionReason() != null) m.put("reason", inst.getDeletionReason());
        return m;
    }
}
