package org.caureq.gpufleet.repo;

import org.caureq.gpufleet.domain.WorkerAuthToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

public interface WorkerAuthTokenRepo extends JpaRepository<WorkerAuthToken, UUID> {

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update WorkerAuthToken t set t.lastUsedAt = :now where t.instanceId = :id")
    int touch(@Param("id") UUID instanceId, @Param("now") Instant now);
}
