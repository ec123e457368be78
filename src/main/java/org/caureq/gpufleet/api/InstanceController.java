package org.caureq.gpufleet.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.gpufleet.api.dto.InstanceDTO;
import org.caureq.gpufleet.api.dto.ProvisionRequestDTO;
import org.caureq.gpufleet.api.dto.TerminateRequestDTO;
import org.caureq.gpufleet.api.dto.VolumeDTO;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.service.InstanceCommandService;
import org.caureq.gpufleet.service.InstanceQueryService;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin/instances")
@RequiredArgsConstructor
public class InstanceController {
    private final InstanceCommandService commands;
    private final InstanceQueryService queries;

    @PostMapping
    public ResponseEntity<InstanceDTO> provision(@Valid @RequestBody ProvisionRequestDTO body,
                                                 @RequestHeader(value = "X-Correlation-Id", required = false) String cid) {
        var inst = commands.requestProvision(new InstanceCommandService.ProvisionRequest(body.provider(), body.zone(),
                body.instanceType(), body.modelId(), body.imageId(), body.dataVolumeGb()), cid);
        return ResponseEntity.accepted().body(InstanceDTO.from(inst));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam(required = false) String status,
                                                    @RequestParam(defaultValue = "0") int page,
                                                    @RequestParam(defaultValue = "50") int size) {
        var filter = status == null || status.isBlank() ? null : InstanceStatus.fromCode(status);
        var result = queries.list(filter, PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), 200),
                Sort.by(Sort.Direction.DESC, "createdAt")));
        return ResponseEntity.ok().body(Map.of(
                "items", result.getContent().stream().map(InstanceDTO::from).toList(),
                "total", result.getTotalElements(),
                "page", result.getNumber(),
                "size", result.getSize()));
    }

    @GetMapping("/{id}")
    public InstanceDTO get(@PathVariable UUID id) {
        return InstanceDTO.from(queries.get(id));
    }

    @GetMapping("/{id}/volumes")
    public List<VolumeDTO> volumes(@PathVariable UUID id) {
        return queries.volumes(id).stream().map(VolumeDTO::from).toList();
    }

    @PostMapping("/{id}/terminate")
    public ResponseEntity<InstanceDTO> terminate(@PathVariable UUID id,
                                                 @Valid @RequestBody(required = false) TerminateRequestDTO body,
                                                 @RequestHeader(value = "X-Correlation-Id", required = false) String cid) {
        var inst = commands.requestTermination(id, body == null ? null : body.reason(), cid);
        return ResponseEntity.accepted().body(InstanceDTO.from(inst));
    }

    @PostMapping("/{id}/drain")
    public InstanceDTO drain(@PathVariable UUID id) {
        return InstanceDTO.from(commands.drain(id));
    }

    @PostMapping("/{id}/archive")
    public InstanceDTO archive(@PathVariable UUID id) {
        return InstanceDTO.from(commands.archive(id));
    }

    @PostMapping("/{id}/reinstall")
    public InstanceDTO reinstall(@PathVariable UUID id) {
        return InstanceDTO.from(commands.reinstall(id));
    }
}
