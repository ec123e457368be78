package org.caureq.gpufleet.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One managed compute resource. Rows are inserted through the repository and
 * afterwards only changed through the column-scoped updates of {@code InstanceRepo}.
 */
@Entity
@Table(name = "instances", indexes = {
        @Index(name = "idx_instance_status", columnList = "status"),
        @Index(name = "idx_instance_provider_id", columnList = "provider_instance_id"),
        @Index(name = "idx_instance_endpoint", columnList = "ip_address, worker_inference_port")
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class Instance {

    @Id
    private UUID id;

    @Column(nullable = false, length = 32)
    private String provider;      // driver key: mock, scaleway

    @Column(length = 64)
    private String zone;

    @Column(name = "instance_type", length = 64)
    private String instanceType;

    @Column(name = "model_id", length = 256)
    private String modelId;

    @Column(name = "image_id", length = 128)
    private String imageId;

    private Integer dataVolumeGb; // model requirement, null -> provider default

    @Column(nullable = false, length = 32)
    private InstanceStatus status;

    @Column(name = "provider_instance_id", length = 128)
    private String providerInstanceId;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    // worker liveness, written by heartbeat ingestion only
    private Instant workerLastHeartbeat;
    @Column(length = 32)
    private String workerStatus;
    @Column(length = 256)
    private String workerModelId;
    private Integer workerHealthPort;
    @Column(name = "worker_inference_port")
    private Integer workerInferencePort;
    private Integer workerQueueDepth;
    private Double workerGpuUtilization;
    @Column(length = 4000)
    private String workerMetadata;

    @Column(nullable = false)
    private Instant createdAt;
    private Instant readyAt;
    private Instant terminatedAt;
    private Instant bootStartedAt;
    private Instant lastHealthCheck;
    private int healthCheckFailures;
    private int retryCount;
    private Instant nextRetryAt;

    @Column(length = 64)
    private String errorCode;
    @Column(length = 2000)
    private String errorMessage;
    private Instant failedAt;

    @Column(length = 64)
    private String deletionReason;
    private boolean deletedByProvider;
    private Instant lastReconciliation;
    private boolean archived;

    @PrePersist
    void prePersist() {
        if (id == null) id = UUID.randomUUID();
        if (createdAt == null) createdAt = Instant.now();
        if (status == null) status = InstanceStatus.PROVISIONING;
    }
}
