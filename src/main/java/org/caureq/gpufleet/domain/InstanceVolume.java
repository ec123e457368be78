package org.caureq.gpufleet.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "instance_volumes", indexes = {
        @Index(name = "idx_volume_instance", columnList = "instance_id")
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class InstanceVolume {

    @Id
    private UUID id;

    @Column(name = "instance_id", nullable = false)
    private UUID instanceId;

    @Column(length = 128)
    private String providerVolumeId;

    @Column(length = 128)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "volume_type", length = 16)
    private VolumeKind volumeType;

    private Long sizeBytes;

    private boolean deleteOnTerminate;

    @Column(nullable = false, length = 16)
    private VolumeStatus status;

    private Instant createdAt;
    private Instant deletedAt;   // soft delete

    @Column(length = 1000)
    private String errorMessage;

    @PrePersist
    void prePersist() {
        if (id == null) id = UUID.randomUUID();
        if (createdAt == null) createdAt = Instant.now();
        if (status == null) status = VolumeStatus.ATTACHED;
    }
}
