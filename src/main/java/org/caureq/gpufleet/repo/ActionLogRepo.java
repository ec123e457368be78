package org.caureq.gpufleet.repo;

import org.caureq.gpufleet.domain.ActionLog;
import org.caureq.gpufleet.domain.ActionStatus;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ActionLogRepo extends JpaRepository<ActionLog, UUID>, JpaSpecificationExecutor<ActionLog> {
    List<ActionLog> findByInstanceIdOrderByCreatedAtAsc(UUID instanceId);
    List<ActionLog> findByInstanceIdAndActionType(UUID instanceId, String actionType);
    long countByInstanceIdAndActionType(UUID instanceId, String actionType);

    /** Completes an in-progress entry; rows already completed are left untouched. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ActionLog a set a.status = :status, a.durationMs = :durationMs, "
            + "a.errorCode = :errorCode, a.errorMessage = :errorMessage, "
            + "a.instanceStatusAfter = :after, a.metadata = :metadata, a.completedAt = :now "
            + "where a.id = :id and a.completedAt is null")
    int complete(@Param("id") UUID id, @Param("status") ActionStatus status,
                 @Param("durationMs") Long durationMs, @Param("errorCode") String errorCode,
                 @Param("errorMessage") String errorMessage, @Param("after") InstanceStatus after,
                 @Param("metadata") String metadata, @Param("now") Instant now);
}
