package org.caureq.gpufleet.api;

import lombok.RequiredArgsConstructor;
import org.caureq.gpufleet.api.dto.ActionLogDTO;
import org.caureq.gpufleet.domain.ActionStatus;
import org.caureq.gpufleet.service.ActionLogService;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin/action-logs")
@RequiredArgsConstructor
public class ActionLogController {
    private final ActionLogService actionLogs;

    @GetMapping
    public ResponseEntity<Map<String, Object>> search(
            @RequestParam(required = false) UUID instanceId,
            @RequestParam(required = false) String actionType,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {
        var filter = new ActionLogService.Filter(instanceId, actionType,
                status == null || status.isBlank() ? null : ActionStatus.fromCode(status), from, to);
        var result = actionLogs.search(filter, PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), 500),
                Sort.by(Sort.Direction.ASC, "createdAt")));
        return ResponseEntity.ok().body(Map.of(
                "items", result.getContent().stream().map(ActionLogDTO::from).toList(),
                "total", result.getTotalElements(),
                "page", result.getNumber(),
                "size", result.getSize()));
    }
}
