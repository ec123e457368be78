package org.caureq.gpufleet.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.gpufleet.api.dto.WorkerHeartbeatRequest;
import org.caureq.gpufleet.api.dto.WorkerRegisterRequest;
import org.caureq.gpufleet.api.dto.WorkerRegisterResponse;
import org.caureq.gpufleet.service.HeartbeatService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Endpoints called by the agent running on each worker host. */
@RestController
@RequestMapping("/internal/worker")
@RequiredArgsConstructor
public class WorkerController {
    private final HeartbeatService heartbeats;

    @PostMapping("/register")
    public ResponseEntity<WorkerRegisterResponse> register(@Valid @RequestBody WorkerRegisterRequest body,
                                                           @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                           HttpServletRequest req) {
        var report = new HeartbeatService.WorkerReport(null, body.modelId(), body.healthPort(),
                body.inferencePort(), null, null, body.metadata());
        var reg = heartbeats.register(body.instanceId(), report, bearer(authorization), req.getRemoteAddr());
        var status = reg.token() != null ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status)
                .body(new WorkerRegisterResponse(reg.instanceId(), reg.token(), "registered"));
    }

    @PostMapping("/heartbeat")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void heartbeat(@Valid @RequestBody WorkerHeartbeatRequest body,
                          @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        var report = new HeartbeatService.WorkerReport(body.status(), body.modelId(), body.healthPort(),
                body.inferencePort(), body.queueDepth(), body.gpuUtilization(), body.metadata());
        heartbeats.heartbeat(body.instanceId(), report, bearer(authorization));
    }

    static String bearer(String header) {
        if (header == null) return null;
        var h = header.trim();
        if (h.regionMatches(true, 0, "Bearer ", 0, 7)) return h.substring(7).trim();
        return null;
    }
}
