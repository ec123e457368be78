package org.caureq.gpufleet.service.jobs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.AppProps;
import org.caureq.gpufleet.service.CatalogSyncService;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogStartupSync {
    private final CatalogSyncService catalog;
    private final JobRunner runner;
    private final AppProps props;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!props.jobs().syncCatalogOnStartup()) return;
        log.info("[Catalog] startup sync requested");
        runner.submit("catalog-sync", catalog::syncAll);
    }
}
