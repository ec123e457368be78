package org.caureq.gpufleet.service.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Resolves the driver for an instance from its persisted {@code provider} key. */
@Component
@Slf4j
public class ProviderRegistry {
    private final Map<String, CloudProvider> providers = new LinkedHashMap<>();

    public ProviderRegistry(List<CloudProvider> drivers) {
        for (var d : drivers) {
            providers.put(d.name().toLowerCase(), d);
        }
        log.info("[Providers] enabled = {}", providers.keySet());
    }

    public CloudProvider get(String name) {
        var p = name == null ? null : providers.get(name.toLowerCase());
        if (p == null) {
            throw ProviderException.permanent("PROVIDER_NOT_CONFIGURED",
                    "No provider driver enabled for '" + name + "'");
        }
        return p;
    }

    public boolean has(String name) {
        return name != null && providers.containsKey(name.toLowerCase());
    }

    public Collection<CloudProvider> all() {
        return providers.values();
    }
}
