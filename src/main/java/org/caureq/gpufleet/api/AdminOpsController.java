package org.caureq.gpufleet.api;

import lombok.RequiredArgsConstructor;
import org.caureq.gpufleet.domain.InstanceType;
import org.caureq.gpufleet.service.InstanceCommandService;
import org.caureq.gpufleet.service.InstanceQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminOpsController {
    private final InstanceCommandService commands;
    private final InstanceQueryService queries;

    @PostMapping("/catalog/sync")
    public ResponseEntity<Map<String, Object>> syncCatalog(
            @RequestHeader(value = "X-Correlation-Id", required = false) String cid) {
        var published = commands.requestCatalogSync(cid);
        return ResponseEntity.accepted().body(Map.of("command", "CMD:SYNC_CATALOG", "published", published));
    }

    @GetMapping("/catalog/{provider}")
    public List<InstanceType> catalog(@PathVariable String provider) {
        return queries.catalog(provider);
    }

    @PostMapping("/reconcile")
    public ResponseEntity<Map<String, Object>> reconcile(
            @RequestHeader(value = "X-Correlation-Id", required = false) String cid) {
        var published = commands.requestReconcile(cid);
        return ResponseEntity.accepted().body(Map.of("command", "CMD:RECONCILE", "published", published));
    }
}
