package org.caureq.gpufleet.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.domain.ActionLog;
import org.caureq.gpufleet.domain.ActionStatus;
import org.caureq.gpufleet.domain.Instance;
import org.caureq.gpufleet.domain.InstanceStatus;
import org.caureq.gpufleet.repo.ActionLogRepo;
import org.caureq.gpufleet.service.provider.ProviderException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Append-only audit trail. External calls are written as an in-progress row
 * and completed once; transitions and alerts are written already completed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionLogService {
    public static final String COMPONENT = "orchestrator";

    private final ActionLogRepo repo;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public record Filter(UUID instanceId, String actionType, ActionStatus status, Instant from, Instant to) {}

    public UUID start(String actionType, Instance instance, Map<String, Object> metadata, UUID parentLogId) {
        var entry = repo.save(ActionLog.builder()
                .actionType(actionType)
                .component(COMPONENT)
                .status(ActionStatus.IN_PROGRESS)
                .instanceId(instance == null ? null : instance.getId())
                .instanceStatusBefore(instance == null ? null : instance.getStatus())
                .metadata(toJson(metadata))
                .parentLogId(parentLogId)
                .createdAt(clock.instant())
                .build());
        return entry.getId();
    }

    /** Completes an in-progress entry; extra metadata is merged over what {@link #start} stored. */
    public void complete(UUID logId, ActionStatus status, long durationMs, String errorCode, String errorMessage,
                         InstanceStatus after, Map<String, Object> extraMetadata) {
        var merged = new LinkedHashMap<String, Object>();
        repo.findById(logId).ifPresent(existing -> merged.putAll(fromJson(existing.getMetadata())));
        if (extraMetadata != null) merged.putAll(extraMetadata);
        int n = repo.complete(logId, status, durationMs, errorCode, truncate(errorMessage), after,
                toJson(merged), clock.instant());
        if (n == 0) {
            log.warn("action log {} already completed, ignoring {}", logId, status);
        }
    }

    /** One-shot entry for a state transition or alert. */
    public UUID record(String actionType, UUID instanceId, InstanceStatus before, InstanceStatus after,
                       ActionStatus status, String errorCode, String errorMessage, Map<String, Object> metadata) {
        var now = clock.instant();
        var entry = repo.save(ActionLog.builder()
                .actionType(actionType)
                .component(COMPONENT)
                .status(status)
                .instanceId(instanceId)
                .instanceStatusBefore(before)
                .instanceStatusAfter(after)
                .durationMs(0L)
                .errorCode(errorCode)
                .errorMessage(truncate(errorMessage))
                .metadata(toJson(metadata))
                .createdAt(now)
                .completedAt(now)
                .build());
        return entry.getId();
    }

    /**
     * Runs one provider call between a start and a completion row. The provider
     * exception is rethrown after the failure is recorded.
     */
    public <T> T traced(String actionType, Instance instance, Map<String, Object> metadata, Supplier<T> call) {
        var logId = start(actionType, instance, metadata, null);
        var started = clock.instant();
        try {
            T result = call.get();
            complete(logId, ActionStatus.SUCCESS, elapsed(started), null, null, instance.getStatus(), null);
            return result;
        } catch (ProviderException ex) {
            complete(logId, ActionStatus.FAILED, elapsed(started), ex.code(), ex.getMessage(), instance.getStatus(),
                    Map.of("retryable", ex.retryable(), "http_status", ex.status()));
            throw ex;
        } catch (RuntimeException ex) {
            complete(logId, ActionStatus.FAILED, elapsed(started), "INTERNAL_ERROR", ex.getMessage(),
                    instance.getStatus(), null);
            throw ex;
        }
    }

    public void tracedRun(String actionType, Instance instance, Map<String, Object> metadata, Runnable call) {
        traced(actionType, instance, metadata, () -> {
            call.run();
            return null;
        });
    }

    public boolean hasEntry(UUID instanceId, String actionType) {
        return repo.countByInstanceIdAndActionType(instanceId, actionType) > 0;
    }

    public Page<ActionLog> search(Filter f, Pageable pageable) {
        Specification<ActionLog> spec = (root, q, cb) -> {
            var ps = new ArrayList<Predicate>();
            if (f.instanceId() != null) ps.add(cb.equal(root.get("instanceId"), f.instanceId()));
            if (f.actionType() != null && !f.actionType().isBlank()) ps.add(cb.equal(root.get("actionType"), f.actionType()));
            if (f.status() != null) ps.add(cb.equal(root.get("status"), f.status()));
            if (f.from() != null) ps.add(cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), f.from()));
            if (f.to() != null) ps.add(cb.lessThan(root.<Instant>get("createdAt"), f.to()));
            return cb.and(ps.toArray(new Predicate[0]));
        };
        return repo.findAll(spec, pageable);
    }

    private long elapsed(Instant started) {
        return Math.max(0, Duration.between(started, clock.instant()).toMillis());
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            return String.valueOf(metadata);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            return Map.of("raw", json);
        }
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > 2000 ? s.substring(0, 2000) : s;
    }
}
