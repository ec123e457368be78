package org.caureq.gpufleet.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Per-provider tunable, maintained by the settings API.
 * The scheduler only reads these rows.
 */
@Entity
@Table(name = "provider_settings", uniqueConstraints = {
        @UniqueConstraint(name = "uk_provider_setting", columnNames = {"provider", "setting_key"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProviderSetting {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String provider;

    @Column(name = "setting_key", nullable = false, length = 64)
    private String settingKey;   // ex: WORKER_INSTANCE_STARTUP_TIMEOUT_S

    private Long valueInt;
    private Boolean valueBool;
    @Column(length = 512)
    private String valueText;
}
