package org.caureq.gpufleet.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/** Append-only audit entry. Completed once, never deleted. */
@Entity
@Table(name = "action_logs", indexes = {
        @Index(name = "idx_action_created", columnList = "created_at DESC"),
        @Index(name = "idx_action_instance", columnList = "instance_id, created_at DESC"),
        @Index(name = "idx_action_type", columnList = "action_type")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ActionLog {
    @Id
    private UUID id;

    @Column(name = "action_type", nullable = false, length = 64)
    private String actionType;    // ex: PROVIDER_CREATE, INSTANCE_READY

    @Column(nullable = false, length = 32)
    private String component;     // ex: orchestrator, worker-api

    @Column(nullable = false, length = 16)
    private ActionStatus status;

    @Column(name = "instance_id")
    private UUID instanceId;

    @Column(length = 32)
    private InstanceStatus instanceStatusBefore;
    @Column(length = 32)
    private InstanceStatus instanceStatusAfter;

    private Long durationMs;

    @Column(length = 64)
    private String errorCode;
    @Column(length = 2000)
    private String errorMessage;

    @Column(length = 4000)
    private String metadata;      // JSON

    private UUID parentLogId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
    private Instant completedAt;

    @PrePersist
    void prePersist() {
        if (id == null) id = UUID.randomUUID();
        if (createdAt == null) createdAt = Instant.now();
    }
}
