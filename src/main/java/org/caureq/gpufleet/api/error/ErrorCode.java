package org.caureq.gpufleet.api.error;

public enum ErrorCode {
    BAD_REQUEST, INSTANCE_NOT_FOUND, INVALID_TRANSITION, TOKEN_CONFLICT, ENDPOINT_CONFLICT,
    AUTH_REQUIRED, FORBIDDEN, STALE_INSTANCE, PROVIDER_4XX, PROVIDER_5XX, TIMEOUT, INTERNAL_ERROR
}
