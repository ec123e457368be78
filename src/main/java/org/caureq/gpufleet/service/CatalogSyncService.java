package org.caureq.gpufleet.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.domain.InstanceType;
import org.caureq.gpufleet.repo.InstanceTypeRepo;
import org.caureq.gpufleet.service.provider.CatalogItem;
import org.caureq.gpufleet.service.provider.CloudProvider;
import org.caureq.gpufleet.service.provider.ProviderException;
import org.caureq.gpufleet.service.provider.ProviderRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;

/** Upserts each provider's server catalog into {@code instance_types}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogSyncService {
    private final InstanceTypeRepo repo;
    private final ProviderRegistry providers;
    private final Clock clock;

    /** @return number of catalog rows written */
    public int syncAll() {
        int total = 0;
        for (var provider : providers.all()) {
            total += sync(provider);
        }
        return total;
    }

    int sync(CloudProvider provider) {
        var items = new LinkedHashMap<String, CatalogItem>();
        boolean complete = true;
        for (var zone : provider.zones()) {
            try {
                for (var item : provider.fetchCatalog(zone)) {
                    items.putIfAbsent(item.code(), item);
                }
            } catch (ProviderException ex) {
                complete = false;
                log.warn("[Catalog] {} {}: {} {}", provider.name(), zone, ex.code(), ex.getMessage());
            }
        }

        var now = clock.instant();
        for (var item : items.values()) {
            var row = repo.findByProviderAndCode(provider.name(), item.code())
                    .orElseGet(() -> InstanceType.builder().provider(provider.name()).code(item.code()).build());
            row.setName(item.name());
            row.setCostPerHour(item.costPerHour());
            row.setCpuCount(item.cpuCount());
            row.setRamGb(item.ramGb());
            row.setGpuCount(item.gpuCount());
            row.setVramPerGpuGb(item.vramPerGpuGb());
            row.setBandwidthBps(item.bandwidthBps());
            row.setActive(true);
            row.setUpdatedAt(now);
            repo.save(row);
        }
        // a partial listing must not retire types that are still sold elsewhere
        if (complete) {
            for (var row : repo.findByProviderAndActiveTrueOrderByCostPerHourAsc(provider.name())) {
                if (!items.containsKey(row.getCode())) {
                    row.setActive(false);
                    row.setUpdatedAt(now);
                    repo.save(row);
                }
            }
        }
        log.info("[Catalog] {}: {} type(s) synced", provider.name(), items.size());
        return items.size();
    }
}
