package org.caureq.gpufleet.api.error;

import org.springframework.http.HttpStatus;

import java.util.Map;
import java.util.UUID;

/** A request the fleet refuses, with the HTTP status the caller should see. */
public class ApiException extends RuntimeException {
    private final HttpStatus status;
    private final ErrorCode code;
    private final Map<String, Object> details;

    public ApiException(HttpStatus status, ErrorCode code, String message) {
        this(status, code, message, Map.of());
    }

    public ApiException(HttpStatus status, ErrorCode code, String message, Map<String, Object> details) {
        super(message);
        this.status = status;
        this.code = code;
        this.details = details == null ? Map.of() : details;
    }

    public static ApiException notFound(UUID instanceId) {
        return new ApiException(HttpStatus.NOT_FOUND, ErrorCode.INSTANCE_NOT_FOUND, "Instance " + instanceId + " not found");
    }

    public static ApiException unauthorized(String message) {
        return new ApiException(HttpStatus.UNAUTHORIZED, ErrorCode.AUTH_REQUIRED, message);
    }

    public static ApiException invalidTransition(UUID instanceId, Object status, String action) {
        return new ApiException(HttpStatus.CONFLICT, ErrorCode.INVALID_TRANSITION,
                "Cannot " + action + " instance " + instanceId + " in status " + status,
                Map.of("status", String.valueOf(status)));
    }

    public HttpStatus status() { return status; }
    public ErrorCode code() { return code; }
    public Map<String, Object> details() { return details; }
}
