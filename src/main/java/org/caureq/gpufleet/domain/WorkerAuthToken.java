package org.caureq.gpufleet.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "worker_auth_tokens")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkerAuthToken {
    @Id
    private UUID instanceId;

    @Column(nullable = false, length = 64)
    private String tokenHash;    // sha-256 hex, the token itself is never stored

    @Column(nullable = false, length = 12)
    private String tokenPrefix;

    @Column(nullable = false)
    private Instant createdAt;
    private Instant lastUsedAt;
    private Instant revokedAt;

    @Version
    private Long version;
}
