package org.caureq.gpufleet.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.domain.ActionStatus;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.domain.InstanceVolume;
import org.caureq.gpufleet.domain.VolumeKind;
import org.caureq.gpufleet.domain.VolumeStatus;
import org.caureq.gpufleet.repo.InstanceVolumeRepo;
import org.caureq.gpufleet.service.provider.CloudProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Ledger side of instance volumes: what we created, and what we found attached. */
@Service
@RequiredArgsConstructor
@Slf4j
public class VolumeService {
    public static final String PROVIDER_DELETED_MESSAGE =
            "provider_deleted: server removed out of band, volume left for an operator";

    private final InstanceVolumeRepo repo;
    private final ActionLogService actionLog;
    private final Clock clock;

    public List<InstanceVolume> volumesOf(Instance inst) {
        return repo.findByInstanceIdOrderByCreatedAtAsc(inst.getId());
    }

    public Optional<InstanceVolume> liveDataVolume(Instance inst) {
        return repo.findByInstanceIdAndStatusIn(inst.getId(), List.of(VolumeStatus.ATTACHED, VolumeStatus.ERROR))
                .stream()
                .filter(v -> v.getVolumeType() == VolumeKind.DATA)
                .findFirst();
    }

    public InstanceVolume recordCreated(Instance inst, String providerVolumeId, String name, long sizeBytes,
                                        VolumeKind kind) {
        return repo.save(InstanceVolume.builder()
                .instanceId(inst.getId())
                .providerVolumeId(providerVolumeId)
                .name(name)
                .volumeType(kind)
                .sizeBytes(sizeBytes)
                .deleteOnTerminate(true)
                .status(VolumeStatus.ATTACHED)
                .createdAt(clock.instant())
                .build());
    }

    /**
     * Records volumes the provider reports on the server that the ledger does
     * not know yet. Boot volumes die with the server; other volumes found this
     * way are not ours to delete.
     *
     * @return number of rows added
     */
    public int importAttached(Instance inst, CloudProvider provider, boolean bootOnly) {
        var attached = provider.listAttachedVolumes(inst.getZone(), inst.getProviderInstanceId());
        int added = 0;
        for (var v : attached) {
            if (bootOnly && !v.boot()) continue;
            if (repo.existsByInstanceIdAndProviderVolumeId(inst.getId(), v.volumeId())) continue;
            repo.save(InstanceVolume.builder()
                    .instanceId(inst.getId())
                    .providerVolumeId(v.volumeId())
                    .name(v.name())
                    .volumeType(v.boot() ? VolumeKind.BOOT : VolumeKind.DATA)
                    .sizeBytes(v.sizeBytes())
                    .deleteOnTerminate(v.boot())
                    .status(VolumeStatus.ATTACHED)
                    .createdAt(clock.instant())
                    .build());
            added++;
        }
        if (added > 0) {
            actionLog.record("VOLUMES_IMPORTED", inst.getId(), inst.getStatus(), inst.getStatus(),
                    ActionStatus.SUCCESS, null, null,
                    Map.of("count", added, "provider_instance_id", inst.getProviderInstanceId()));
            log.info("instance {}: imported {} attached volume(s)", inst.getId(), added);
        }
        return added;
    }

    /**
     * Closes the volume rows of an instance whose server vanished at the
     * provider. No provider call follows, so boot volumes are taken as gone
     * with the server, owned data volumes are marked error and foreign ones
     * released.
     *
     * @return number of rows closed
     */
    public int closeAfterProviderDeletion(Instance inst) {
        var now = clock.instant();
        int boot = 0, failed = 0, released = 0;
        for (var v : repo.findByInstanceIdAndStatusIn(inst.getId(),
                List.of(VolumeStatus.ATTACHED, VolumeStatus.DETACHING))) {
            if (v.getVolumeType() == VolumeKind.BOOT) {
                boot += repo.markDeleted(v.getId(), VolumeStatus.DELETED, now);
            } else if (v.isDeleteOnTerminate()) {
                failed += repo.moveStatus(v.getId(), v.getStatus(), VolumeStatus.ERROR, PROVIDER_DELETED_MESSAGE);
            } else {
                released += repo.moveStatus(v.getId(), v.getStatus(), VolumeStatus.DETACHED, null);
            }
        }
        int closed = boot + failed + released;
        if (closed > 0) {
            actionLog.record("VOLUMES_CLOSED_PROVIDER_DELETED", inst.getId(),
                    InstanceStatus.TERMINATED, InstanceStatus.TERMINATED,
                    failed > 0 ? ActionStatus.FAILED : ActionStatus.SUCCESS, failed > 0 ? "VOLUMES_ORPHANED" : null,
                    failed > 0 ? failed + " data volume(s) may still exist at the provider" : null,
                    Map.of("boot_deleted", boot, "data_failed", failed, "released", released));
            if (failed > 0) {
                log.warn("instance {}: {} data volume(s) orphaned by provider deletion", inst.getId(), failed);
            }
        }
        return closed;
    }
}
