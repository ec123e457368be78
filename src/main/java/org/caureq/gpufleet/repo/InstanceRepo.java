package org.caureq.gpufleet.repo;

import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger access for instances. Every update is guarded by the status (or lease)
 * the caller read, and returns the number of rows changed: 0 means another
 * actor got there first and the caller must not perform side effects.
 */
@Transactional(readOnly = true)
public interface InstanceRepo extends JpaRepository<Instance, UUID> {

    Page<Instance> findByStatus(InstanceStatus status, Pageable pageable);
    Page<Instance> findByArchivedFalse(Pageable pageable);
    Optional<Instance> findByProviderInstanceId(String providerInstanceId);
    List<Instance> findByProviderAndStatusIn(String provider, Collection<InstanceStatus> statuses);
    boolean existsByProviderInstanceId(String providerInstanceId);

    boolean existsByIpAddressAndWorkerInferencePortAndStatusInAndIdNot(
            String ipAddress, Integer workerInferencePort, Collection<InstanceStatus> statuses, UUID id);

    /* --------------------- job candidates --------------------- */

    @Query("select i from Instance i "
            + "where i.status = :status "
            + "and i.failedAt is null "
            + "and i.createdAt < :graceCutoff "
            + "and (i.lastReconciliation is null or i.lastReconciliation < :leaseCutoff) "
            + "and i.retryCount < :maxRetries "
            + "and (i.nextRetryAt is null or i.nextRetryAt <= :now) "
            + "order by i.createdAt asc")
    List<Instance> findProvisioningCandidates(@Param("status") InstanceStatus status,
                                              @Param("now") Instant now,
                                              @Param("graceCutoff") Instant graceCutoff,
                                              @Param("leaseCutoff") Instant leaseCutoff,
                                              @Param("maxRetries") int maxRetries,
                                              Pageable pageable);

    @Query("select i from Instance i "
            + "where i.status = :status "
            + "and (i.lastHealthCheck is null or i.lastHealthCheck < :cutoff) "
            + "order by i.createdAt asc")
    List<Instance> findHealthCandidates(@Param("status") InstanceStatus status,
                                        @Param("cutoff") Instant cutoff,
                                        Pageable pageable);

    @Query("select i from Instance i "
            + "where i.status in :statuses "
            + "and (i.lastReconciliation is null or i.lastReconciliation < :cutoff) "
            + "order by i.createdAt asc")
    List<Instance> findLeaseCandidates(@Param("statuses") Collection<InstanceStatus> statuses,
                                       @Param("cutoff") Instant cutoff,
                                       Pageable pageable);

    /* --------------------- leases --------------------- */

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.lastReconciliation = :now "
            + "where i.id = :id and (i.lastReconciliation is null or i.lastReconciliation < :cutoff)")
    int claimReconciliationLease(@Param("id") UUID id, @Param("now") Instant now, @Param("cutoff") Instant cutoff);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.lastHealthCheck = :now "
            + "where i.id = :id and (i.lastHealthCheck is null or i.lastHealthCheck < :cutoff)")
    int claimHealthCheckLease(@Param("id") UUID id, @Param("now") Instant now, @Param("cutoff") Instant cutoff);

    /* --------------------- status transitions --------------------- */

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.status = :to, i.bootStartedAt = :now, i.errorCode = null, i.errorMessage = null "
            + "where i.id = :id and i.status = :from")
    int startBoot(@Param("id") UUID id, @Param("from") InstanceStatus from, @Param("to") InstanceStatus to,
                  @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.status = :to, i.errorCode = :code, i.errorMessage = :message, "
            + "i.failedAt = coalesce(i.failedAt, :now), "
            + "i.healthCheckFailures = i.healthCheckFailures + :failureIncrement "
            + "where i.id = :id and i.status = :from")
    int fail(@Param("id") UUID id, @Param("from") InstanceStatus from, @Param("to") InstanceStatus to,
             @Param("code") String code, @Param("message") String message, @Param("now") Instant now,
             @Param("failureIncrement") int failureIncrement);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.status = :to, i.readyAt = :now, i.lastHealthCheck = :now, i.healthCheckFailures = 0 "
            + "where i.id = :id and i.status = :from")
    int markReady(@Param("id") UUID id, @Param("from") InstanceStatus from, @Param("to") InstanceStatus to,
                  @Param("now") Instant now);

    /** Plain status move with no bookkeeping (drain). */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.status = :to where i.id = :id and i.status = :from")
    int moveStatus(@Param("id") UUID id, @Param("from") InstanceStatus from, @Param("to") InstanceStatus to);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.status = :to, i.deletionReason = :reason, "
            + "i.errorCode = :errorCode, i.errorMessage = :errorMessage, i.lastReconciliation = null "
            + "where i.id = :id and i.status in :from")
    int requestTermination(@Param("id") UUID id, @Param("from") Collection<InstanceStatus> from,
                           @Param("to") InstanceStatus to, @Param("reason") String reason,
                           @Param("errorCode") String errorCode, @Param("errorMessage") String errorMessage);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.status = :to, i.terminatedAt = coalesce(i.terminatedAt, :now), "
            + "i.errorCode = null, i.errorMessage = null "
            + "where i.id = :id and i.status = :from")
    int confirmTerminated(@Param("id") UUID id, @Param("from") InstanceStatus from, @Param("to") InstanceStatus to,
                          @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.status = :to, i.terminatedAt = coalesce(i.terminatedAt, :now), "
            + "i.deletedByProvider = true, i.deletionReason = :reason, i.lastReconciliation = :now "
            + "where i.id = :id and i.status in :from")
    int markProviderDeleted(@Param("id") UUID id, @Param("from") Collection<InstanceStatus> from,
                            @Param("to") InstanceStatus to, @Param("reason") String reason,
                            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.status = :to, i.archived = true where i.id = :id and i.status = :from")
    int archive(@Param("id") UUID id, @Param("from") InstanceStatus from, @Param("to") InstanceStatus to);

    /* --------------------- field updates (no status change) --------------------- */

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.providerInstanceId = :providerInstanceId "
            + "where i.id = :id and i.providerInstanceId is null and i.status = :expected")
    int recordProviderInstanceId(@Param("id") UUID id, @Param("expected") InstanceStatus expected,
                                 @Param("providerInstanceId") String providerInstanceId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.ipAddress = :ip where i.id = :id and i.status = :expected")
    int recordIpAddress(@Param("id") UUID id, @Param("expected") InstanceStatus expected, @Param("ip") String ip);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.retryCount = i.retryCount + 1, i.nextRetryAt = :nextRetryAt, "
            + "i.errorCode = :code, i.errorMessage = :message "
            + "where i.id = :id and i.status = :expected")
    int recordTransientFailure(@Param("id") UUID id, @Param("expected") InstanceStatus expected,
                               @Param("code") String code, @Param("message") String message,
                               @Param("nextRetryAt") Instant nextRetryAt);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.errorCode = :code, i.errorMessage = :message where i.id = :id and i.status = :expected")
    int recordError(@Param("id") UUID id, @Param("expected") InstanceStatus expected,
                    @Param("code") String code, @Param("message") String message);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.deletionReason = :reason where i.id = :id and i.deletionReason is null")
    int recordDeletionReason(@Param("id") UUID id, @Param("reason") String reason);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.healthCheckFailures = i.healthCheckFailures + 1 where i.id = :id and i.status = :expected")
    int incrementHealthCheckFailures(@Param("id") UUID id, @Param("expected") InstanceStatus expected);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.healthCheckFailures = 0 where i.id = :id and i.healthCheckFailures > 0")
    int resetHealthCheckFailures(@Param("id") UUID id);

    /** First stale observation of a ready worker; only one caller gets 1 back per episode. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.healthCheckFailures = 1 "
            + "where i.id = :id and i.status = :expected and i.healthCheckFailures = 0")
    int openStaleEpisode(@Param("id") UUID id, @Param("expected") InstanceStatus expected);

    /** Reinstall: new boot attempt on the same remote server. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.bootStartedAt = :now, i.healthCheckFailures = 0, "
            + "i.workerLastHeartbeat = null, i.workerStatus = null, "
            + "i.errorCode = null, i.errorMessage = null "
            + "where i.id = :id and i.status = :expected")
    int restartBoot(@Param("id") UUID id, @Param("expected") InstanceStatus expected, @Param("now") Instant now);

    /* --------------------- worker liveness --------------------- */

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.workerLastHeartbeat = :now, "
            + "i.workerStatus = :status, "
            + "i.workerModelId = :modelId, "
            + "i.workerHealthPort = :healthPort, "
            + "i.workerInferencePort = :inferencePort, "
            + "i.workerQueueDepth = :queueDepth, "
            + "i.workerGpuUtilization = :gpuUtilization, "
            + "i.workerMetadata = :metadata "
            + "where i.id = :id")
    int recordWorkerLiveness(@Param("id") UUID id, @Param("now") Instant now,
                             @Param("status") String status,
                             @Param("modelId") String modelId,
                             @Param("healthPort") Integer healthPort,
                             @Param("inferencePort") Integer inferencePort,
                             @Param("queueDepth") Integer queueDepth,
                             @Param("gpuUtilization") Double gpuUtilization,
                             @Param("metadata") String metadata);
}
