package org.caureq.gpufleet.service;

import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.domain.Instance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;

/**
 * Renders the cloud-init user data pushed to a worker host. The agent it starts
 * registers itself against the control plane and then heartbeats.
 */
@Component
public class BootstrapScriptRenderer {
    static final String TEMPLATE = "bootstrap/worker-cloud-init.sh";

    private final AppProps props;
    private final ProviderSettingsService settings;
    private final String template;

    public BootstrapScriptRenderer(AppProps props, ProviderSettingsService settings) {
        this.props = props;
        this.settings = settings;
        try (var in = new ClassPathResource(TEMPLATE).getInputStream()) {
            this.template = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load " + TEMPLATE, e);
        }
    }

    public String render(Instance inst) {
        var provider = inst.getProvider();
        var values = new LinkedHashMap<String, String>();
        values.put("CONTROL_PLANE_URL", props.worker().controlPlaneUrl());
        values.put("INSTANCE_ID", String.valueOf(inst.getId()));
        values.put("MODEL_ID", inst.getModelId() == null ? "" : inst.getModelId());
        values.put("VLLM_MODE", settings.vllmMode(provider));
        values.put("WORKER_HEALTH_PORT", String.valueOf(settings.healthPort(provider)));
        values.put("WORKER_VLLM_PORT", String.valueOf(settings.inferencePort(provider)));

        var out = template;
        for (var e : values.entrySet()) {
            out = out.replace("{{" + e.getKey() + "}}", e.getValue());
        }
        return out;
    }
}
