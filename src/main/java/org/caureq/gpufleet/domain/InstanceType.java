package org.caureq.gpufleet.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/** Catalog entry synchronised from a provider's product list. */
@Entity
@Table(name = "instance_types", uniqueConstraints = {
        @UniqueConstraint(name = "uk_instance_type", columnNames = {"provider", "code"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class InstanceType {
    @Id
    private UUID id;

    @Column(nullable = false, length = 32)
    private String provider;

    @Column(nullable = false, length = 64)
    private String code;

    @Column(length = 128)
    private String name;

    private double costPerHour;
    private int cpuCount;
    private int ramGb;
    private int gpuCount;
    private int vramPerGpuGb;
    private long bandwidthBps;
    private boolean active;
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        if (id == null) id = UUID.randomUUID();
        if (updatedAt == null) updatedAt = Instant.now();
    }
}
