package org.caureq.gpufleet.service;

import lombok.RequiredArgsConstructor;
import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.ProviderSetting;
import org.caureq.gpufleet.repo.ProviderSettingRepo;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Tunables resolved as: provider_settings row, then application config, then built-in default.
 */
@Service
@RequiredArgsConstructor
public class ProviderSettingsService {
    public static final String INSTANCE_STARTUP_TIMEOUT_S = "INSTANCE_STARTUP_TIMEOUT_S";
    public static final String WORKER_INSTANCE_STARTUP_TIMEOUT_S = "WORKER_INSTANCE_STARTUP_TIMEOUT_S";
    public static final String WORKER_HEALTH_PORT = "WORKER_HEALTH_PORT";
    public static final String WORKER_INFERENCE_PORT = "WORKER_INFERENCE_PORT";
    public static final String DEFAULT_VOLUME_GB = "DEFAULT_VOLUME_GB";
    public static final String VLLM_MODE = "VLLM_MODE";

    private final ProviderSettingRepo repo;
    private final AppProps props;
    private final WorkerTargets workerTargets;

    public Optional<Long> intSetting(String provider, String key) {
        return repo.findByProviderAndSettingKey(provider, key).map(ProviderSetting::getValueInt);
    }

    public Optional<String> textSetting(String provider, String key) {
        return repo.findByProviderAndSettingKey(provider, key)
                .map(ProviderSetting::getValueText)
                .filter(s -> !s.isBlank());
    }

    public boolean isWorkerTarget(Instance inst) {
        return workerTargets.matches(inst.getInstanceType());
    }

    public Duration startupTimeout(Instance inst) {
        boolean worker = isWorkerTarget(inst);
        var key = worker ? WORKER_INSTANCE_STARTUP_TIMEOUT_S : INSTANCE_STARTUP_TIMEOUT_S;
        var fromDb = intSetting(inst.getProvider(), key).filter(v -> v > 0).map(Duration::ofSeconds);
        if (fromDb.isPresent()) return fromDb.get();
        var w = props.worker();
        var configured = worker ? w.workerStartupTimeout() : w.startupTimeout();
        if (configured != null) return configured;
        return worker ? Duration.ofSeconds(3600) : Duration.ofSeconds(300);
    }

    public int healthPort(String provider) {
        return port(provider, WORKER_HEALTH_PORT, props.worker().healthPort(), 8080);
    }

    public int inferencePort(String provider) {
        return port(provider, WORKER_INFERENCE_PORT, props.worker().inferencePort(), 8000);
    }

    public int defaultVolumeGb(String provider) {
        var fromDb = intSetting(provider, DEFAULT_VOLUME_GB).filter(v -> v > 0);
        if (fromDb.isPresent()) return fromDb.get().intValue();
        int configured = props.worker().defaultVolumeGb();
        return configured > 0 ? configured : 200;
    }

    public String vllmMode(String provider) {
        return textSetting(provider, VLLM_MODE).orElse("mono");
    }

    private int port(String provider, String key, int configured, int fallback) {
        var fromDb = intSetting(provider, key).filter(v -> v > 0 && v < 65536);
        if (fromDb.isPresent()) return fromDb.get().intValue();
        return configured > 0 ? configured : fallback;
    }
}
