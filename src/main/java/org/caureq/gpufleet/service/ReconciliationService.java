package org.caureq.gpufleet.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.domain.ActionStatus;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.repo.InstanceVolumeRepo;
import org.caureq.gpufleet.service.lifecycle.InstanceTransitions;
import org.caureq.gpufleet.service.provider.CloudProvider;
import org.caureq.gpufleet.service.provider.ProviderException;
import org.caureq.gpufleet.service.provider.ProviderRegistry;
import org.caureq.gpufleet.service.provider.RemoteInstance;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Compares the ledger with what providers actually run. Detection only: the
 * sole automatic action is marking an active instance whose server vanished
 * as deleted by the provider.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {
    public static final String DETECTED_BY_WATCH_DOG = "watch_dog";
    public static final String DETECTED_BY_FULL_RECONCILIATION = "full_reconciliation";

    private static final Set<InstanceStatus> RETIRED = EnumSet.of(InstanceStatus.TERMINATED, InstanceStatus.ARCHIVED);

    private final InstanceRepo repo;
    private final InstanceVolumeRepo volumeRepo;
    private final ProviderRegistry providers;
    private final InstanceTransitions transitions;
    private final VolumeService volumes;
    private final ActionLogService actionLog;

    public record Report(int remoteSeen, int orphans, int terminatedButRunning, int providerDeleted, int zoneErrors) {}

    /** One watch-dog pass over an active instance whose lease the caller holds. */
    public void watch(Instance inst) {
        if (!inst.getStatus().isActive() || inst.getProviderInstanceId() == null) return;
        if (inst.getZone() == null) {
            log.warn("instance {}: active without zone, cannot watch", inst.getId());
            return;
        }
        try {
            var provider = providers.get(inst.getProvider());
            if (!provider.instanceExists(inst.getZone(), inst.getProviderInstanceId())) {
                log.warn("instance {}: server {} is gone", inst.getId(), inst.getProviderInstanceId());
                if (transitions.markProviderDeleted(inst, DETECTED_BY_WATCH_DOG)) {
                    volumes.closeAfterProviderDeletion(inst);
                }
                return;
            }
            if (volumeRepo.countByInstanceId(inst.getId()) == 0) {
                volumes.importAttached(inst, provider, false);
            }
        } catch (ProviderException ex) {
            log.warn("instance {}: watch-dog check failed: {} {}", inst.getId(), ex.code(), ex.getMessage());
        }
    }

    public Report fullReconcile() {
        int seen = 0, orphans = 0, zombies = 0, deleted = 0, errors = 0;
        for (var provider : providers.all()) {
            for (var zone : provider.zones()) {
                try {
                    var remote = provider.listInstances(zone);
                    var remoteIds = new HashSet<String>();
                    for (var r : remote) {
                        if (r.isGone()) continue;
                        seen++;
                        remoteIds.add(r.providerId());
                        var known = repo.findByProviderInstanceId(r.providerId());
                        if (known.isEmpty()) {
                            if (!inFlight(r)) {
                                alert("ORPHAN_REMOTE_DETECTED", null, null, remoteMeta(provider, r));
                                orphans++;
                            }
                        } else if (RETIRED.contains(known.get().getStatus())) {
                            var inst = known.get();
                            alert("TERMINATED_BUT_RUNNING", inst.getId(), inst.getStatus(), remoteMeta(provider, r));
                            zombies++;
                        }
                    }
                    deleted += confirmMissing(provider, zone, remoteIds);
                } catch (ProviderException ex) {
                    errors++;
                    log.warn("[Reconcile] {} {} listing failed: {} {}", provider.name(), zone, ex.code(), ex.getMessage());
                }
            }
        }
        var report = new Report(seen, orphans, zombies, deleted, errors);
        log.info("[Reconcile] done: {}", report);
        return report;
    }

    private int confirmMissing(CloudProvider provider, String zone, Set<String> remoteIds) {
        int n = 0;
        for (var inst : repo.findByProviderAndStatusIn(provider.name(), InstanceStatus.ACTIVE)) {
            if (inst.getProviderInstanceId() == null || !zone.equals(inst.getZone())) continue;
            if (remoteIds.contains(inst.getProviderInstanceId())) continue;
            // listings can lag; ask for the server itself before concluding
            if (provider.instanceExists(zone, inst.getProviderInstanceId())) continue;
            if (transitions.markProviderDeleted(inst, DETECTED_BY_FULL_RECONCILIATION)) {
                volumes.closeAfterProviderDeletion(inst);
                n++;
            }
        }
        return n;
    }

    /** Servers named after a ledger row that has not recorded their id yet. */
    private boolean inFlight(RemoteInstance r) {
        var name = r.name();
        if (name == null || !name.startsWith("gpu-")) return false;
        try {
            var id = UUID.fromString(name.substring(4));
            return repo.findById(id).map(i -> !RETIRED.contains(i.getStatus())).orElse(false);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void alert(String type, UUID instanceId, InstanceStatus status, Map<String, Object> meta) {
        actionLog.record(type, instanceId, status, status, ActionStatus.FAILED, type, null, meta);
        log.warn("[Reconcile] {} {}", type, meta);
    }

    private static Map<String, Object> remoteMeta(CloudProvider provider, RemoteInstance r) {
        var m = new HashMap<String, Object>();
        m.put("provider", provider.name());
        m.put("zone", r.zone());
        m.put("provider_instance_id", r.providerId());
        m.put("name", r.name());
        m.put("remote_status", r.status());
        return m;
    }
}
