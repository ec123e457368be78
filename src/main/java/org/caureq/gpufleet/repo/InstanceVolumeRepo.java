package org.caureq.gpufleet.repo;

import org.caureq.gpufleet.domain.InstanceVolume;
import org.caureq.gpufleet.domain.VolumeStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface InstanceVolumeRepo extends JpaRepository<InstanceVolume, UUID> {
    List<InstanceVolume> findByInstanceIdOrderByCreatedAtAsc(UUID instanceId);
    List<InstanceVolume> findByInstanceIdAndStatusIn(UUID instanceId, Collection<VolumeStatus> statuses);
    long countByInstanceId(UUID instanceId);
    long countByInstanceIdAndStatus(UUID instanceId, VolumeStatus status);
    boolean existsByInstanceIdAndProviderVolumeId(UUID instanceId, String providerVolumeId);

    /** Soft delete; a second call for the same volume changes nothing. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update InstanceVolume v set v.status = :deleted, v.deletedAt = :now, v.errorMessage = null "
            + "where v.id = :id and v.status <> :deleted")
    int markDeleted(@Param("id") UUID id, @Param("deleted") VolumeStatus deleted, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update InstanceVolume v set v.status = :to, v.errorMessage = :message where v.id = :id and v.status = :from")
    int moveStatus(@Param("id") UUID id, @Param("from") VolumeStatus from, @Param("to") VolumeStatus to,
                   @Param("message") String message);
}
