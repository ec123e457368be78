package org.caureq.gpufleet.repo;

import org.caureq.gpufleet.domain.InstanceType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface InstanceTypeRepo extends JpaRepository<InstanceType, UUID> {
    Optional<InstanceType> findByProviderAndCode(String provider, String code);
    List<InstanceType> findByProviderAndActiveTrueOrderByCostPerHourAsc(String provider);
    boolean existsByProvider(String provider);
}
