package org.caureq.gpufleet.service;

import lombok.RequiredArgsConstructor;
import org.caureq.gpufleet.api.error.ApiException;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.domain.InstanceType;
import org.caureq.gpufleet.domain.InstanceVolume;
import org.caureq.gpufleet.repo.InstanceRepo;
import org.caureq.gpufleet.repo.InstanceTypeRepo;
import org.caureq.gpufleet.repo.InstanceVolumeRepo;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class InstanceQueryService {
    private final InstanceRepo repo;
    private final InstanceVolumeRepo volumeRepo;
    private final InstanceTypeRepo typeRepo;

    /** Without a status, archived rows are hidden. */
    public Page<Instance> list(InstanceStatus status, Pageable pageable) {
        return status == null ? repo.findByArchivedFalse(pageable) : repo.findByStatus(status, pageable);
    }

    public Instance get(UUID id) {
        return repo.findById(id).orElseThrow(() -> ApiException.notFound(id));
    }

    public List<InstanceVolume> volumes(UUID id) {
        get(id);
        return volumeRepo.findByInstanceIdOrderByCreatedAtAsc(id);
    }

    public List<InstanceType> catalog(String provider) {
        return typeRepo.findByProviderAndActiveTrueOrderByCostPerHourAsc(provider.toLowerCase());
    }
}
